package com.jreinhal.quarry.rag.fusion;

import com.jreinhal.quarry.QueryTag;
import com.jreinhal.quarry.model.ChunkHit;
import com.jreinhal.quarry.model.DenseQuery;
import java.util.List;

/**
 * Read-only ranked-list provider over the document chunk store.
 *
 * <p>Calls may block; the fuser invokes them from pool threads and bounds them with a deadline.
 * Implementations signal connectivity problems by throwing, never by returning an empty list.</p>
 */
public interface ChunkStore {
    /**
     * Text search for one of the lexical-group channels ({@code SHORT}, {@code TITLE}, {@code LEXICAL}).
     */
    List<ChunkHit> searchText(RetrievalChannel channel, String query, QueryTag tag, int limit);

    List<ChunkHit> searchDense(DenseQuery query, QueryTag tag, int limit);

    /**
     * Chunks of the document named by a slug hint, in chunk order. Stores without slug lookup return nothing.
     */
    default List<ChunkHit> fetchByDocSlug(String slug, int limit) {
        return List.of();
    }
}
