package com.jreinhal.quarry.rag.limits;

import com.jreinhal.quarry.QueryTag;

public interface TagLimitsProvider {
    /**
     * Limits for the tag, or the provider's defaults when the tag has no entry.
     */
    TagLimits limitsFor(QueryTag tag);
}
