package com.jreinhal.quarry;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Topical label attached to a question. Selects the sentence-scoring bonus
 * table, the channel hint terms and the per-tag retrieval limits.
 */
public enum QueryTag {
    OPS_HEALTH("ops_health",
            Set.of("env", "environment", "environments", "health", "healthcheck", "cache", "prefix", "rollback", "canary", "monitor", "monitoring", "uptime", "alert", "alerts", "restart", "status", "port", "timeout"),
            List.of("health", "env"),
            List.of()),
    DB_WORKFLOWS("db_workflows",
            Set.of(),
            List.of("create", "index", "alter", "table"),
            List.of("create index", "alter table", "create table", "using gin", "using hnsw")),
    RAG_QA_SINGLE("rag_qa_single", Set.of(), List.of(), List.of()),
    RAG_QA_MULTI("rag_qa_multi", Set.of(), List.of(), List.of()),
    META_OPS("meta_ops",
            Set.of("deploy", "deployment", "deployed", "rollout", "release", "canary", "manifest", "runbook", "gate", "gates", "ci", "pipeline", "promote", "rollback"),
            List.of("deploy", "rollout"),
            List.of()),
    NEGATIVES("negatives", Set.of(), List.of(), List.of()),
    GENERAL("general", Set.of(), List.of(), List.of());

    private final String label;
    private final Set<String> bonusTokens;
    private final List<String> hintTerms;
    private final List<String> phraseHints;

    private QueryTag(String label, Set<String> bonusTokens, List<String> hintTerms, List<String> phraseHints) {
        this.label = label;
        this.bonusTokens = bonusTokens;
        this.hintTerms = hintTerms;
        this.phraseHints = phraseHints;
    }

    public String getLabel() {
        return this.label;
    }

    /**
     * Tokens that earn the tag bonus when a context sentence contains one of them.
     * Empty for tags without a bonus.
     */
    public Set<String> getBonusTokens() {
        return this.bonusTokens;
    }

    public List<String> getHintTerms() {
        return this.hintTerms;
    }

    public List<String> getPhraseHints() {
        return this.phraseHints;
    }

    public boolean isDatabaseWorkflow() {
        return this == DB_WORKFLOWS;
    }

    /**
     * Resolves a tag from its label or enum name, case-insensitively.
     *
     * @throws IllegalArgumentException if the label is blank or unknown
     */
    public static QueryTag fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Tag label must not be blank");
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (QueryTag tag : QueryTag.values()) {
            if (tag.label.equals(normalized) || tag.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return tag;
            }
        }
        throw new IllegalArgumentException("Unknown tag: " + label);
    }
}
