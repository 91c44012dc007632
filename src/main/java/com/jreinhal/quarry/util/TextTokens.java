package com.jreinhal.quarry.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Case-insensitive tokenization shared by the channel builder, the context assembler and the diversifier.
 * A token is a run of letters, digits, underscores, dots and dashes with leading and trailing dots and
 * dashes trimmed, so sentence punctuation does not stick to words.
 */
public final class TextTokens {
    private static final Pattern TOKEN = Pattern.compile("[a-z0-9_.\\-]+");
    private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");

    private TextTokens() {
    }

    public static List<String> tokenList(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<String>();
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = trimEdges(matcher.group());
            if (token.isEmpty()) continue;
            tokens.add(token);
        }
        return tokens;
    }

    public static Set<String> tokens(String text) {
        return new LinkedHashSet<String>(tokenList(text));
    }

    public static Set<String> tokens(String text, Set<String> stopWords) {
        LinkedHashSet<String> tokens = new LinkedHashSet<String>();
        for (String token : tokenList(text)) {
            if (stopWords.contains(token)) continue;
            tokens.add(token);
        }
        return tokens;
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        for (String token : smaller) {
            if (!larger.contains(token)) continue;
            ++intersection;
        }
        int union = a.size() + b.size() - intersection;
        return union == 0 ? 0.0 : (double)intersection / (double)union;
    }

    private static String trimEdges(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && isEdgePunctuation(token.charAt(start))) {
            ++start;
        }
        while (end > start && isEdgePunctuation(token.charAt(end - 1))) {
            --end;
        }
        return token.substring(start, end);
    }

    private static boolean isEdgePunctuation(char c) {
        return c == '.' || c == '-';
    }
}
