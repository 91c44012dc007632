package com.jreinhal.quarry.model;

/**
 * A scored sentence taken from one candidate during context assembly.
 *
 * @param candidateScore retrieval score of the originating candidate, used only to break ties
 */
public record SentencePick(String sourcePath, String chunkId, String sentence, double score, double candidateScore) {
    static final double TIE_BREAK_WEIGHT = 1e-6;

    public double rankKey() {
        return this.score + TIE_BREAK_WEIGHT * this.candidateScore;
    }

    public String annotatedLine() {
        return "[" + this.sourcePath + "#chunk:" + this.chunkId + "] " + this.sentence;
    }
}
