package com.jreinhal.quarry.rag.diversify;

/**
 * @param alpha relevance share of the MMR objective, in [0, 1]
 * @param perFilePenalty subtracted once per already-selected candidate from the same source file
 */
public record MmrSettings(double alpha, double perFilePenalty) {
    public static final MmrSettings DEFAULT = new MmrSettings(0.85, 0.10);

    public MmrSettings {
        if (!(alpha >= 0.0 && alpha <= 1.0)) {
            throw new IllegalArgumentException("alpha must be within [0, 1], got " + alpha);
        }
        if (!(perFilePenalty >= 0.0)) {
            throw new IllegalArgumentException("perFilePenalty must be >= 0, got " + perFilePenalty);
        }
    }
}
