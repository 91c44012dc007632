package com.jreinhal.quarry.rag.channel;

import com.jreinhal.quarry.QueryTag;
import com.jreinhal.quarry.model.ChannelQuerySet;

/**
 * Derives the per-channel query forms for a question.
 *
 * <p>Implementations must be deterministic for identical (question, tag) pairs, return
 * {@link ChannelQuerySet#empty()} for a blank question, and never return an empty lexical
 * form for a non-blank one.</p>
 */
public interface QueryChannelBuilder {
    ChannelQuerySet build(String question, QueryTag tag);
}
