package com.jreinhal.quarry.rag.reader;

/**
 * Bounds for context assembly.
 *
 * @param perChunk sentences kept per candidate
 * @param total sentences kept overall
 * @param maxChars length bound of the assembled context text
 */
public record ReaderSettings(int perChunk, int total, int maxChars) {
    public static final ReaderSettings DEFAULT = new ReaderSettings(2, 10, 6000);

    public ReaderSettings {
        if (perChunk < 0) {
            throw new IllegalArgumentException("perChunk must be >= 0, got " + perChunk);
        }
        if (total < 0) {
            throw new IllegalArgumentException("total must be >= 0, got " + total);
        }
        if (maxChars < 0) {
            throw new IllegalArgumentException("maxChars must be >= 0, got " + maxChars);
        }
    }
}
