package com.jreinhal.quarry.rag.fusion;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * File-type prior applied multiplicatively to the fused score, clamped to plus or minus five percent.
 * Code and configuration sources are nudged up, personal notes down.
 */
final class SourcePrior {
    private static final Pattern CODE_EXTENSION = Pattern.compile("\\.(sql|sh|bash|zsh|py|ipynb|yaml|yml|toml|ini|env|dockerfile)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCHEMA_STATEMENT = Pattern.compile("\\b(CREATE|ALTER)\\s+(INDEX|TABLE)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NOTES_NAME = Pattern.compile("(readme|notes|journal|diary|thoughts)");
    static final double MIN_MULTIPLIER = 0.95;
    static final double MAX_MULTIPLIER = 1.05;

    private SourcePrior() {
    }

    static double prior(String sourcePath, String text) {
        String filename = filename(sourcePath);
        String body = text != null ? text : "";
        double boost = 0.0;
        if (CODE_EXTENSION.matcher(filename).find()) {
            boost = 0.25;
        } else if (body.contains("```")) {
            boost = 0.15;
        } else if (SCHEMA_STATEMENT.matcher(body).find()) {
            boost = 0.20;
        }
        if (NOTES_NAME.matcher(filename.toLowerCase(Locale.ROOT)).find()) {
            boost -= 0.20;
        }
        return boost / 10.0;
    }

    static double multiplier(double prior) {
        return Math.min(MAX_MULTIPLIER, Math.max(MIN_MULTIPLIER, 1.0 + prior));
    }

    private static String filename(String sourcePath) {
        if (sourcePath == null) {
            return "";
        }
        int slash = Math.max(sourcePath.lastIndexOf('/'), sourcePath.lastIndexOf('\\'));
        return slash >= 0 ? sourcePath.substring(slash + 1) : sourcePath;
    }
}
