package com.jreinhal.quarry.model;

import java.util.List;
import java.util.function.Function;

/**
 * The text fields a stored chunk may expose. Stores populate whichever fields they carry;
 * readers call {@link #resolve()} to get the first non-blank one.
 */
public record ChunkText(String textForReader, String text, String embeddingText, String bm25Text, String content) {
    private static final List<Function<ChunkText, String>> RESOLUTION_ORDER = List.of(
            ChunkText::textForReader,
            ChunkText::text,
            ChunkText::embeddingText,
            ChunkText::bm25Text,
            ChunkText::content);

    public static ChunkText ofContent(String content) {
        return new ChunkText(null, null, null, null, content);
    }

    public String resolve() {
        for (Function<ChunkText, String> accessor : RESOLUTION_ORDER) {
            String value = accessor.apply(this);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "";
    }
}
