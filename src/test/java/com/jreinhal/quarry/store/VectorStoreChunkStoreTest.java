package com.jreinhal.quarry.store;

import com.jreinhal.quarry.QueryTag;
import com.jreinhal.quarry.exception.RetrievalException;
import com.jreinhal.quarry.model.ChunkHit;
import com.jreinhal.quarry.model.DenseQuery;
import com.jreinhal.quarry.rag.fusion.RetrievalChannel;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.ObjectProvider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VectorStoreChunkStoreTest {
    private VectorStore vectorStore;
    private VectorStoreChunkStore chunkStore;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        vectorStore = mock(VectorStore.class);
        ObjectProvider<VectorStore> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(vectorStore);
        chunkStore = new VectorStoreChunkStore(provider);
    }

    private static Document doc(String id, String text, Map<String, Object> metadata, Double score) {
        return Document.builder().id(id).text(text).metadata(metadata).score(score).build();
    }

    @Test
    void denseSearchMapsMetadataAndScores() {
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of(
                doc("d1", "Health checks run every minute.", Map.of("file_path", "ops/health.md", "chunk_id", "3"), 0.82)));

        List<ChunkHit> hits = chunkStore.searchDense(new DenseQuery("health checks"), QueryTag.OPS_HEALTH, 5);

        assertEquals(1, hits.size());
        assertEquals("ops/health.md", hits.get(0).sourcePath());
        assertEquals("3", hits.get(0).chunkId());
        assertEquals(0.82, hits.get(0).score(), 1e-9);
        assertEquals("Health checks run every minute.", hits.get(0).text().resolve());
    }

    @Test
    void denseSearchFallsBackToRankWhenScoreMissing() {
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of(
                doc("d1", "first", Map.of("source", "a.md", "chunk_index", 0), null),
                doc("d2", "second", Map.of("source", "b.md", "chunk_index", 1), null)));

        List<ChunkHit> hits = chunkStore.searchDense(new DenseQuery("anything"), QueryTag.GENERAL, 5);

        assertEquals(1.0, hits.get(0).score(), 1e-9);
        assertEquals(0.5, hits.get(1).score(), 1e-9);
        assertEquals("a.md", hits.get(0).sourcePath());
        assertEquals("1", hits.get(1).chunkId());
    }

    @Test
    void textChannelsRankTheSimilarityPoolLexically() {
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of(
                doc("d1", "Nothing relevant here.", Map.of("file_path", "a.md"), 0.9),
                doc("d2", "Set the cache prefix with CACHE_PREFIX.", Map.of("file_path", "b.md"), 0.7),
                doc("d3", "Cache settings overview.", Map.of("file_path", "c.md"), 0.6)));

        List<ChunkHit> hits = chunkStore.searchText(RetrievalChannel.LEXICAL, "cache prefix", QueryTag.OPS_HEALTH, 5);

        assertThat(hits).extracting(ChunkHit::sourcePath).containsExactly("b.md", "c.md");
        assertTrue(hits.get(0).score() > hits.get(1).score());
    }

    @Test
    void textChannelPoolIsWiderThanLimit() {
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of());
        ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);

        chunkStore.searchText(RetrievalChannel.SHORT, "cache prefix", QueryTag.GENERAL, 4);

        verify(vectorStore).similaritySearch(captor.capture());
        assertEquals(12, captor.getValue().getTopK());
        assertEquals("cache prefix", captor.getValue().getQuery());
    }

    @Test
    void titleChannelReadsTitleMetadata() {
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of(
                doc("d1", "rollback body", Map.of("file_path", "x.md", "title", "Rollback runbook"), 0.5),
                doc("d2", "rollback body", Map.of("file_path", "y.md", "title", "Release notes"), 0.5)));

        List<ChunkHit> hits = chunkStore.searchText(RetrievalChannel.TITLE, "rollback", QueryTag.META_OPS, 5);

        assertThat(hits).extracting(ChunkHit::sourcePath).containsExactly("x.md");
    }

    @Test
    void lexicalChannelPrefersBm25Text() {
        Document withLexical = doc("d1", "unrelated body", Map.of("file_path", "x.md", "bm25_text", "gin index on body"), 0.5);

        assertEquals("gin index on body", VectorStoreChunkStore.fieldFor(RetrievalChannel.LEXICAL, withLexical));
        assertEquals("x.md unrelated body", VectorStoreChunkStore.fieldFor(RetrievalChannel.SHORT, withLexical));
        assertEquals("x.md", VectorStoreChunkStore.fieldFor(RetrievalChannel.TITLE, withLexical));
    }

    @Test
    void slugFetchFiltersByPathInChunkOrder() {
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of(
                doc("d1", "step two", Map.of("file_path", "docs/001_setup.md", "chunk_id", "1"), 0.9),
                doc("d2", "other", Map.of("file_path", "docs/002_other.md", "chunk_id", "0"), 0.8),
                doc("d3", "step one", Map.of("file_path", "docs/001_setup.md", "chunk_id", "0"), 0.7)));

        List<ChunkHit> hits = chunkStore.fetchByDocSlug("001_setup", 8);

        assertThat(hits).extracting(ChunkHit::key).containsExactly("docs/001_setup.md#0", "docs/001_setup.md#1");
    }

    @Test
    void bm25IsZeroWithoutSharedTerms() {
        assertEquals(0.0, VectorStoreChunkStore.bm25(Set.of("cache"), "nothing to see"), 1e-9);
        assertTrue(VectorStoreChunkStore.bm25(Set.of("cache"), "cache cache") > 0.0);
    }

    @Test
    @SuppressWarnings("unchecked")
    void missingVectorStoreFailsReads() {
        ObjectProvider<VectorStore> provider = mock(ObjectProvider.class);
        VectorStoreChunkStore unconfigured = new VectorStoreChunkStore(provider);

        assertThrows(RetrievalException.class, () -> unconfigured.searchDense(new DenseQuery("q"), QueryTag.GENERAL, 5));
    }

    @Test
    void vectorStoreErrorsPropagate() {
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenThrow(new IllegalStateException("connection refused"));

        assertThrows(IllegalStateException.class, () -> chunkStore.searchText(RetrievalChannel.LEXICAL, "q", QueryTag.GENERAL, 5));
    }
}
