package com.jreinhal.quarry.rag.reader;

import com.jreinhal.quarry.model.RankedSource;
import com.jreinhal.quarry.util.TextTokens;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Packs ranked sources into a flat {@code [doc:ID] snippet} context under a character budget,
 * for callers that do not need sentence scoring.
 */
@Component
public class BudgetedContextPacker {
    public static final int DEFAULT_MAX_CHARS = 1600;
    public static final int DEFAULT_MAX_PER_DOCUMENT = 2;
    static final int SNIPPET_CHAR_LIMIT = 600;
    private static final String SEPARATOR = "\n\n";
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

    public String pack(List<RankedSource> ranked, Function<String, String> textLookup) {
        return this.pack(ranked, textLookup, DEFAULT_MAX_CHARS, DEFAULT_MAX_PER_DOCUMENT);
    }

    public String pack(List<RankedSource> ranked, Function<String, String> textLookup, int maxChars, int maxPerDocument) {
        if (maxChars < 0 || maxPerDocument < 0) {
            throw new IllegalArgumentException("maxChars and maxPerDocument must be >= 0");
        }
        if (ranked == null || ranked.isEmpty() || textLookup == null) {
            return "";
        }
        List<RankedSource> ordered = new ArrayList<RankedSource>(ranked);
        ordered.sort(Comparator.comparingDouble(RankedSource::score).reversed());
        Map<String, Integer> perDocument = new HashMap<String, Integer>();
        StringBuilder packed = new StringBuilder();
        int blocks = 0;
        for (RankedSource source : ordered) {
            int used = perDocument.getOrDefault(source.sourceId(), 0);
            if (used >= maxPerDocument) continue;
            String text = textLookup.apply(source.sourceId());
            if (text == null || text.isBlank()) continue;
            String header = "[doc:" + source.sourceId() + "] ";
            String block = header + snippet(text);
            int separator = blocks > 0 ? SEPARATOR.length() : 0;
            if (packed.length() + separator + block.length() > maxChars) {
                int room = maxChars - header.length();
                if (blocks == 0 && room > 0) {
                    packed.append(header).append(block.substring(header.length(), header.length() + room).strip());
                }
                break;
            }
            if (blocks > 0) {
                packed.append(SEPARATOR);
            }
            packed.append(block);
            ++blocks;
            perDocument.put(source.sourceId(), used + 1);
        }
        return packed.toString();
    }

    static String snippet(String text) {
        String body = text.strip();
        int end = body.length();
        Matcher matcher = SENTENCE_END.matcher(body);
        int boundaries = 0;
        while (matcher.find()) {
            if (++boundaries == 2) {
                end = matcher.start();
                break;
            }
        }
        end = Math.min(end, SNIPPET_CHAR_LIMIT);
        return TextTokens.collapseWhitespace(body.substring(0, end));
    }
}
