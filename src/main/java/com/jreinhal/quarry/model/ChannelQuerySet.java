package com.jreinhal.quarry.model;

import java.util.List;
import java.util.Optional;

/**
 * Query representations derived from one (question, tag) pair.
 */
public record ChannelQuerySet(String shortQuery, String titleQuery, String lexicalQuery, Optional<DenseQuery> dense, List<String> phraseHints, Optional<String> docHint) {
    private static final ChannelQuerySet EMPTY = new ChannelQuerySet("", "", "", Optional.empty(), List.of(), Optional.empty());

    public ChannelQuerySet {
        shortQuery = shortQuery != null ? shortQuery : "";
        titleQuery = titleQuery != null ? titleQuery : "";
        lexicalQuery = lexicalQuery != null ? lexicalQuery : "";
        dense = dense != null ? dense : Optional.empty();
        phraseHints = phraseHints != null ? List.copyOf(phraseHints) : List.of();
        docHint = docHint != null ? docHint : Optional.empty();
    }

    public static ChannelQuerySet empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return this.lexicalQuery.isBlank();
    }
}
