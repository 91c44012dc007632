package com.jreinhal.quarry.model;

public enum AnswerSource {
    RULE_EXTRACTED,
    GENERATIVE_FALLBACK,
    ABSTAINED;
}
