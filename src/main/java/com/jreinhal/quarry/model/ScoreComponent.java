package com.jreinhal.quarry.model;

public enum ScoreComponent {
    SHORT,
    TITLE,
    LEXICAL,
    VECTOR,
    PRIOR,
    FUSED,
    RERANKED,
    DIVERSIFIED;
}
