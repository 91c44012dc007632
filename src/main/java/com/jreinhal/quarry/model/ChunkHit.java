package com.jreinhal.quarry.model;

import java.util.Objects;

/**
 * One row returned by the chunk store for a single retrieval channel.
 */
public record ChunkHit(String sourcePath, String chunkId, ChunkText text, double score) {
    public ChunkHit {
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(chunkId, "chunkId");
        text = text != null ? text : ChunkText.ofContent("");
        score = Double.isFinite(score) ? Math.max(0.0, score) : 0.0;
    }

    public String key() {
        return this.sourcePath + "#" + this.chunkId;
    }
}
