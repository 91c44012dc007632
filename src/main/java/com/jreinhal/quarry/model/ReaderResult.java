package com.jreinhal.quarry.model;

import java.util.List;

/**
 * Outcome of one reader call: the answer plus the context and candidates it was read from.
 */
public record ReaderResult(Answer answer, ContextBundle context, List<Candidate> usedCandidates) {
    public ReaderResult {
        usedCandidates = usedCandidates != null ? List.copyOf(usedCandidates) : List.of();
    }
}
