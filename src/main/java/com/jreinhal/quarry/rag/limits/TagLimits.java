package com.jreinhal.quarry.rag.limits;

/**
 * Retrieval sizes for one tag: how many candidates the fuser shortlists and how many reach the reader.
 */
public record TagLimits(int shortlistSize, int topk) {
    public static final TagLimits DEFAULT = new TagLimits(24, 8);

    public TagLimits {
        if (shortlistSize < 1) {
            throw new IllegalArgumentException("shortlistSize must be >= 1, got " + shortlistSize);
        }
        if (topk < 1) {
            throw new IllegalArgumentException("topk must be >= 1, got " + topk);
        }
    }
}
