package com.jreinhal.quarry.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A retrieved chunk travelling through fusion, diversification and capping.
 *
 * <p>Identity (source path, chunk id) and text are fixed at construction. Component
 * scores are written by the fuser, the reranker and the diversifier; later stages only read them.</p>
 */
public final class Candidate {
    private final String sourcePath;
    private final String chunkId;
    private final ChunkText text;
    private final EnumMap<ScoreComponent, Double> scores = new EnumMap<>(ScoreComponent.class);

    public Candidate(String sourcePath, String chunkId, ChunkText text) {
        this.sourcePath = Objects.requireNonNull(sourcePath, "sourcePath");
        this.chunkId = Objects.requireNonNull(chunkId, "chunkId");
        this.text = text != null ? text : ChunkText.ofContent("");
    }

    public static Candidate fromHit(ChunkHit hit) {
        return new Candidate(hit.sourcePath(), hit.chunkId(), hit.text());
    }

    public String getSourcePath() {
        return this.sourcePath;
    }

    public String getChunkId() {
        return this.chunkId;
    }

    public ChunkText getText() {
        return this.text;
    }

    public String resolvedText() {
        return this.text.resolve();
    }

    public String key() {
        return this.sourcePath + "#" + this.chunkId;
    }

    public double score(ScoreComponent component) {
        Double value = this.scores.get(component);
        return value != null ? value : 0.0;
    }

    public boolean hasScore(ScoreComponent component) {
        return this.scores.containsKey(component);
    }

    public void putScore(ScoreComponent component, double value) {
        this.scores.put(component, value);
    }

    public void retainScores(Set<ScoreComponent> keep) {
        this.scores.keySet().retainAll(keep);
    }

    public Map<ScoreComponent, Double> getScores() {
        return Collections.unmodifiableMap(this.scores);
    }

    /**
     * Score of the latest ranking stage the candidate passed through.
     */
    public double retrievalScore() {
        if (this.scores.containsKey(ScoreComponent.DIVERSIFIED)) {
            return this.scores.get(ScoreComponent.DIVERSIFIED);
        }
        return this.relevance();
    }

    /**
     * Relevance before diversification: the rerank blend when the candidate was reranked, else the fused score.
     */
    public double relevance() {
        if (this.scores.containsKey(ScoreComponent.RERANKED)) {
            return this.scores.get(ScoreComponent.RERANKED);
        }
        return this.score(ScoreComponent.FUSED);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Candidate)) {
            return false;
        }
        Candidate other = (Candidate)o;
        return this.sourcePath.equals(other.sourcePath) && this.chunkId.equals(other.chunkId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.sourcePath, this.chunkId);
    }

    @Override
    public String toString() {
        return "Candidate[" + this.key() + ", scores=" + this.scores + "]";
    }
}
