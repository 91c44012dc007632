package com.jreinhal.quarry.model;

import java.util.List;

/**
 * Compact reader context: newline-joined annotated lines and the picks that produced them, in the same order.
 */
public record ContextBundle(String text, List<SentencePick> picks) {
    private static final ContextBundle EMPTY = new ContextBundle("", List.of());

    public ContextBundle {
        text = text != null ? text : "";
        picks = picks != null ? List.copyOf(picks) : List.of();
    }

    public static ContextBundle empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return this.picks.isEmpty();
    }
}
