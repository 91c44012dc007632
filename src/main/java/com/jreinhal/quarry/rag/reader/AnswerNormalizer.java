package com.jreinhal.quarry.rag.reader;

import com.jreinhal.quarry.QueryTag;
import com.jreinhal.quarry.util.TextTokens;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Canonical form for rule-based and generative answers alike. Output is never blank and never
 * longer than {@value #MAX_LENGTH} characters; normalizing a normalized answer is a no-op.
 */
@Component
public class AnswerNormalizer {
    public static final String UNKNOWN = "I don't know";
    public static final int MAX_LENGTH = 180;
    private static final String ELLIPSIS = "...";
    private static final Pattern TRAILING_NOISE = Pattern.compile("(?U)[\\s;`]+$");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    public String normalize(String raw, QueryTag tag) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String answer = raw.strip();
        if (tag != null && tag.isDatabaseWorkflow()) {
            answer = reduceToSchemaLine(answer);
        }
        String previous;
        do {
            previous = answer;
            answer = TRAILING_NOISE.matcher(answer).replaceAll("");
            answer = TextTokens.collapseWhitespace(answer);
        } while (!answer.equals(previous));
        if (answer.isEmpty()) {
            return UNKNOWN;
        }
        if (answer.length() > MAX_LENGTH) {
            answer = answer.substring(0, MAX_LENGTH - ELLIPSIS.length()) + ELLIPSIS;
        }
        return answer;
    }

    private static String reduceToSchemaLine(String answer) {
        List<String> lines = new ArrayList<String>();
        for (String line : LINE_BREAK.split(answer)) {
            if (line.isBlank()) continue;
            lines.add(line.strip());
        }
        if (lines.isEmpty()) {
            return "";
        }
        String shortestSchema = null;
        int schemaLines = 0;
        for (String line : lines) {
            if (!SchemaPatterns.containsSchemaKeyword(line)) continue;
            ++schemaLines;
            if (shortestSchema != null && line.length() >= shortestSchema.length()) continue;
            shortestSchema = line;
        }
        return schemaLines > 1 ? shortestSchema : lines.get(0);
    }
}
