package com.jreinhal.quarry.rag.reader;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Line access to context text with the {@code [source#chunk:id]} annotations removed.
 */
final class ContextLines {
    private static final Pattern ANNOTATION = Pattern.compile("^\\s*\\[[^\\]\\n]*#chunk:[^\\]\\n]*\\]\\s*");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    private ContextLines() {
    }

    static List<String> lines(String context) {
        if (context == null || context.isBlank()) {
            return List.of();
        }
        List<String> lines = new ArrayList<String>();
        for (String raw : LINE_BREAK.split(context)) {
            String line = stripAnnotation(raw).strip();
            if (line.isEmpty()) continue;
            lines.add(line);
        }
        return lines;
    }

    static String stripAnnotation(String line) {
        return ANNOTATION.matcher(line).replaceFirst("");
    }
}
