package com.jreinhal.quarry.rag.reader;

import com.jreinhal.quarry.QueryTag;
import com.jreinhal.quarry.constant.StopWords;
import com.jreinhal.quarry.util.TextTokens;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Rule-based answer extraction from assembled context. Rules run cheapest and least ambiguous
 * first; the first that fires wins:
 * <ol>
 *   <li>a file path token</li>
 *   <li>the shortest schema-definition line (database-workflow questions only)</li>
 *   <li>the longest double-quoted phrase</li>
 *   <li>the first short line that is not a section header</li>
 * </ol>
 * An empty result means no rule fired and the generative fallback should be asked.
 */
@Component
public class DeterministicSpanExtractor {
    static final int MAX_SPAN = 180;
    private static final Pattern PATH = Pattern.compile(
            "(?<![\\w/:.\\-])((?:[\\w.\\-]+/)+[\\w\\-]+(?:\\.[\\w\\-]+)*\\.[A-Za-z][A-Za-z0-9]{0,7}"
            + "|[\\w\\-]+\\.(?:md|py|sql|sh|java|kt|ts|tsx|js|json|ya?ml|toml|txt|go|rs|ini|cfg|env|ipynb|xml|csv|rb|html|css))(?![\\w/])");
    private static final Pattern QUOTED = Pattern.compile("\"([^\"\\n]+)\"");
    private static final Pattern PATH_SEPARATORS = Pattern.compile("[/._\\-]");
    private static final Pattern RULE_LINE = Pattern.compile("^[=\\-*_]{3,}$");

    public Optional<String> extract(String context, String question, QueryTag tag) {
        List<String> lines = ContextLines.lines(context);
        if (lines.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> path = this.pathMatch(lines, question);
        if (path.isPresent()) {
            return path;
        }
        if (tag != null && tag.isDatabaseWorkflow()) {
            Optional<String> schemaLine = this.schemaLine(lines);
            if (schemaLine.isPresent()) {
                return schemaLine;
            }
        }
        Optional<String> quoted = this.quotedPhrase(lines);
        if (quoted.isPresent()) {
            return quoted;
        }
        return this.shortLine(lines);
    }

    private Optional<String> pathMatch(List<String> lines, String question) {
        List<String> paths = new ArrayList<String>();
        for (String line : lines) {
            Matcher matcher = PATH.matcher(line);
            while (matcher.find()) {
                paths.add(matcher.group(1));
            }
        }
        if (paths.isEmpty()) {
            return Optional.empty();
        }
        Set<String> questionTokens = TextTokens.tokens(question, StopWords.READER);
        if (!questionTokens.isEmpty()) {
            for (String path : paths) {
                for (String token : pathTokens(path)) {
                    if (questionTokens.contains(token)) {
                        return Optional.of(path);
                    }
                }
            }
        }
        return Optional.of(paths.get(0));
    }

    private Optional<String> schemaLine(List<String> lines) {
        String shortest = null;
        for (String line : lines) {
            if (!SchemaPatterns.containsSchemaKeyword(line)) continue;
            if (shortest != null && line.length() >= shortest.length()) continue;
            shortest = line;
        }
        if (shortest == null) {
            return Optional.empty();
        }
        return Optional.of(shortest.length() > MAX_SPAN ? shortest.substring(0, MAX_SPAN) : shortest);
    }

    private Optional<String> quotedPhrase(List<String> lines) {
        String longest = null;
        for (String line : lines) {
            Matcher matcher = QUOTED.matcher(line);
            while (matcher.find()) {
                String phrase = matcher.group(1).strip();
                if (phrase.isEmpty()) continue;
                if (longest != null && phrase.length() <= longest.length()) continue;
                longest = phrase;
            }
        }
        if (longest == null || longest.length() > MAX_SPAN) {
            return Optional.empty();
        }
        return Optional.of(longest);
    }

    private Optional<String> shortLine(List<String> lines) {
        for (String line : lines) {
            if (line.length() > MAX_SPAN || isSectionHeader(line)) continue;
            return Optional.of(line);
        }
        return Optional.empty();
    }

    /**
     * Whole path segments plus their parts split on dots, underscores and dashes.
     */
    static Set<String> pathTokens(String path) {
        Set<String> tokens = new LinkedHashSet<String>(TextTokens.tokens(path.replace('/', ' ')));
        tokens.addAll(TextTokens.tokens(PATH_SEPARATORS.matcher(path).replaceAll(" ")));
        return tokens;
    }

    private static boolean isSectionHeader(String line) {
        return line.startsWith("#") || RULE_LINE.matcher(line).matches();
    }
}
