package com.jreinhal.quarry.model;

/**
 * Input for the vector channel. The store embeds {@code text} itself.
 */
public record DenseQuery(String text) {
    public DenseQuery {
        text = text != null ? text : "";
    }
}
