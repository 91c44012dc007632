package com.jreinhal.quarry.model;

public record Answer(String text, AnswerSource source) {
    public boolean isRuleExtracted() {
        return this.source == AnswerSource.RULE_EXTRACTED;
    }
}
