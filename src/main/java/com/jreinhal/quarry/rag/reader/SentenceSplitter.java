package com.jreinhal.quarry.rag.reader;

import com.jreinhal.quarry.util.TextTokens;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits chunk text into sentences. Long texts are split per line, since they are usually code
 * or tables where prose boundaries misfire.
 */
final class SentenceSplitter {
    static final int LINE_SPLIT_THRESHOLD = 4000;
    private static final Pattern PROSE_BOUNDARY = Pattern.compile(
            "(?<=[.!?])\\s+(?=[A-Z0-9])|\\n\\s*\\n|\\n(?=[ \\t]*(?:[A-Z0-9#`*>|]|- ))");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final Pattern SIMPLE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

    private SentenceSplitter() {
    }

    /**
     * @return sentences with internal whitespace collapsed, blank pieces dropped
     */
    static List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Pattern boundary = text.length() > LINE_SPLIT_THRESHOLD ? LINE_BREAK : PROSE_BOUNDARY;
        List<String> sentences = new ArrayList<String>();
        for (String piece : boundary.split(text.strip())) {
            String sentence = TextTokens.collapseWhitespace(piece);
            if (sentence.isEmpty()) continue;
            sentences.add(sentence);
        }
        return sentences;
    }

    /**
     * Punctuation-only split used on already line-oriented context text.
     */
    static List<String> splitSimple(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> sentences = new ArrayList<String>();
        for (String piece : SIMPLE_BOUNDARY.split(text.strip())) {
            String sentence = piece.strip();
            if (sentence.isEmpty()) continue;
            sentences.add(sentence);
        }
        return sentences;
    }

    static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        for (String line : LINE_BREAK.split(text)) {
            if (line.isBlank()) continue;
            return TextTokens.collapseWhitespace(line);
        }
        return "";
    }
}
