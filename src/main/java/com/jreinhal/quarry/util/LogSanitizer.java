package com.jreinhal.quarry.util;

import com.jreinhal.quarry.QueryTag;

/**
 * Log-safe renderings of reader input. Questions are reduced to their tag, shape and a stable id;
 * other caller-supplied values are flattened to one bounded line.
 */
public final class LogSanitizer {
    static final int MAX_VALUE_LENGTH = 120;

    private LogSanitizer() {
    }

    public static String querySummary(String question) {
        return querySummary(question, null);
    }

    /**
     * Identifies a question in log output without printing it, e.g.
     * {@code [tag=db_workflows,len=42,terms=7,form=question,id=5f1c2a9]}.
     */
    public static String querySummary(String question, QueryTag tag) {
        StringBuilder summary = new StringBuilder("[");
        if (tag != null) {
            summary.append("tag=").append(tag.getLabel()).append(',');
        }
        if (question == null || question.isBlank()) {
            return summary.append("len=0,id=none]").toString();
        }
        String trimmed = question.strip();
        return summary.append("len=").append(trimmed.length())
                .append(",terms=").append(TextTokens.tokenList(trimmed).size())
                .append(",form=").append(form(trimmed))
                .append(",id=").append(Integer.toHexString(trimmed.hashCode()))
                .append(']')
                .toString();
    }

    /**
     * Flattens a caller-supplied value (a tag label, a store message) to a single line: line breaks
     * and tabs become spaces, other control characters are dropped, and long values are cut.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(Math.min(value.length(), MAX_VALUE_LENGTH));
        for (int i = 0; i < value.length(); ++i) {
            char c = value.charAt(i);
            if (c == '\r' || c == '\n' || c == '\t') {
                out.append(' ');
            } else if (!Character.isISOControl(c)) {
                out.append(c);
            }
        }
        String flat = TextTokens.collapseWhitespace(out.toString());
        return flat.length() > MAX_VALUE_LENGTH ? flat.substring(0, MAX_VALUE_LENGTH) + "..." : flat;
    }

    static String form(String question) {
        if (question.indexOf('"') >= 0) {
            return "quoted";
        }
        return question.endsWith("?") ? "question" : "statement";
    }
}
