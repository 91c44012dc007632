package com.jreinhal.quarry.store;

import com.jreinhal.quarry.QueryTag;
import com.jreinhal.quarry.exception.RetrievalException;
import com.jreinhal.quarry.model.ChunkHit;
import com.jreinhal.quarry.model.ChunkText;
import com.jreinhal.quarry.model.DenseQuery;
import com.jreinhal.quarry.rag.fusion.ChunkStore;
import com.jreinhal.quarry.rag.fusion.RetrievalChannel;
import com.jreinhal.quarry.util.TextTokens;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * {@link ChunkStore} over a Spring AI {@link VectorStore}.
 *
 * <p>The vector channel is a plain similarity search. The text channels draw a wider similarity
 * pool and rank it with BM25 against the field that channel reads: the title for {@code TITLE},
 * path plus content for {@code SHORT}, and the lexical text for {@code LEXICAL}.</p>
 *
 * <p>Without a configured vector store every read throws {@link RetrievalException}.</p>
 */
@Component
public class VectorStoreChunkStore implements ChunkStore {
    private static final Logger log = LoggerFactory.getLogger(VectorStoreChunkStore.class);
    static final String META_FILE_PATH = "file_path";
    static final String META_SOURCE = "source";
    static final String META_CHUNK_ID = "chunk_id";
    static final String META_CHUNK_INDEX = "chunk_index";
    static final String META_TITLE = "title";
    static final String META_TEXT_FOR_READER = "text_for_reader";
    static final String META_EMBEDDING_TEXT = "embedding_text";
    static final String META_BM25_TEXT = "bm25_text";
    static final String META_CONTENT = "content";
    private static final double K1 = 1.2;
    private static final double B = 0.75;
    private static final double AVG_DOC_LENGTH = 500.0;
    private final VectorStore vectorStore;
    @Value(value="${quarry.store.text-pool-multiplier:3}")
    private int textPoolMultiplier = 3;
    @Value(value="${quarry.store.similarity-threshold:0.0}")
    private double similarityThreshold = 0.0;

    public VectorStoreChunkStore(ObjectProvider<VectorStore> vectorStore) {
        this.vectorStore = vectorStore.getIfAvailable();
    }

    @PostConstruct
    public void init() {
        if (this.vectorStore == null) {
            log.warn("No VectorStore bean configured; chunk store reads will fail");
            return;
        }
        log.info("Vector store chunk store initialized (store={}, textPoolMultiplier={}, similarityThreshold={})", new Object[]{this.vectorStore.getClass().getSimpleName(), this.textPoolMultiplier, this.similarityThreshold});
    }

    @Override
    public List<ChunkHit> searchDense(DenseQuery query, QueryTag tag, int limit) {
        if (limit <= 0 || query.text().isBlank()) {
            return List.of();
        }
        List<Document> documents = this.similarity(query.text(), limit);
        List<ChunkHit> hits = new ArrayList<ChunkHit>(documents.size());
        for (int i = 0; i < documents.size(); ++i) {
            Document doc = documents.get(i);
            double score = doc.getScore() != null ? doc.getScore() : 1.0 / (double)(i + 1);
            hits.add(toHit(doc, score));
        }
        return hits;
    }

    @Override
    public List<ChunkHit> searchText(RetrievalChannel channel, String query, QueryTag tag, int limit) {
        if (limit <= 0 || query == null || query.isBlank()) {
            return List.of();
        }
        Set<String> queryTerms = TextTokens.tokens(query);
        if (queryTerms.isEmpty()) {
            return List.of();
        }
        List<Document> pool = this.similarity(query, limit * Math.max(1, this.textPoolMultiplier));
        List<ChunkHit> scored = new ArrayList<ChunkHit>();
        for (Document doc : pool) {
            double score = bm25(queryTerms, fieldFor(channel, doc));
            if (score <= 0.0) continue;
            scored.add(toHit(doc, score));
        }
        scored.sort(Comparator.comparingDouble(ChunkHit::score).reversed());
        if (log.isDebugEnabled()) {
            log.debug("Text channel {}: pool={}, matched={}", new Object[]{channel, pool.size(), scored.size()});
        }
        return scored.size() > limit ? new ArrayList<ChunkHit>(scored.subList(0, limit)) : scored;
    }

    @Override
    public List<ChunkHit> fetchByDocSlug(String slug, int limit) {
        if (limit <= 0 || slug == null || slug.isBlank()) {
            return List.of();
        }
        String needle = slug.toLowerCase(Locale.ROOT);
        List<Document> pool = this.similarity(slug.replace('_', ' '), Math.max(limit, limit * this.textPoolMultiplier));
        List<ChunkHit> hits = new ArrayList<ChunkHit>();
        for (Document doc : pool) {
            if (!sourcePath(doc).toLowerCase(Locale.ROOT).contains(needle)) continue;
            hits.add(toHit(doc, 1.0));
        }
        hits.sort(Comparator.comparingInt(VectorStoreChunkStore::chunkOrder).thenComparing(ChunkHit::chunkId));
        return hits.size() > limit ? new ArrayList<ChunkHit>(hits.subList(0, limit)) : hits;
    }

    private List<Document> similarity(String query, int topK) {
        if (this.vectorStore == null) {
            throw new RetrievalException("No vector store configured");
        }
        SearchRequest request = SearchRequest.builder().query(query).topK(topK).similarityThreshold(this.similarityThreshold).build();
        List<Document> documents = this.vectorStore.similaritySearch(request);
        return documents != null ? documents : List.of();
    }

    static String fieldFor(RetrievalChannel channel, Document doc) {
        Map<String, Object> metadata = doc.getMetadata();
        switch (channel) {
            case TITLE: {
                String title = metadataString(metadata, META_TITLE);
                return title != null ? title : fileName(sourcePath(doc));
            }
            case SHORT: {
                return sourcePath(doc) + " " + contentOf(doc);
            }
            default: {
                String lexical = metadataString(metadata, META_BM25_TEXT);
                return lexical != null ? lexical : contentOf(doc);
            }
        }
    }

    static double bm25(Set<String> queryTerms, String field) {
        List<String> docTerms = TextTokens.tokenList(field);
        if (docTerms.isEmpty()) {
            return 0.0;
        }
        int docLength = docTerms.size();
        double idf = Math.log(2.0);
        double score = 0.0;
        for (String term : queryTerms) {
            long tf = docTerms.stream().filter(t -> t.equals(term)).count();
            if (tf == 0L) continue;
            double numerator = (double)tf * (K1 + 1.0);
            double denominator = (double)tf + K1 * (1.0 - B + B * ((double)docLength / AVG_DOC_LENGTH));
            score += idf * (numerator / denominator);
        }
        return score;
    }

    static ChunkHit toHit(Document doc, double score) {
        Map<String, Object> metadata = doc.getMetadata();
        ChunkText text = new ChunkText(metadataString(metadata, META_TEXT_FOR_READER), doc.getText(), metadataString(metadata, META_EMBEDDING_TEXT), metadataString(metadata, META_BM25_TEXT), metadataString(metadata, META_CONTENT));
        return new ChunkHit(sourcePath(doc), chunkId(doc), text, score);
    }

    static String sourcePath(Document doc) {
        Map<String, Object> metadata = doc.getMetadata();
        String path = metadataString(metadata, META_FILE_PATH);
        if (path == null) {
            path = metadataString(metadata, META_SOURCE);
        }
        return path != null ? path : doc.getId();
    }

    static String chunkId(Document doc) {
        Map<String, Object> metadata = doc.getMetadata();
        String id = metadataString(metadata, META_CHUNK_ID);
        if (id == null) {
            id = metadataString(metadata, META_CHUNK_INDEX);
        }
        return id != null ? id : doc.getId();
    }

    private static String contentOf(Document doc) {
        String text = doc.getText();
        if (text != null && !text.isBlank()) {
            return text;
        }
        String content = metadataString(doc.getMetadata(), META_CONTENT);
        return content != null ? content : "";
    }

    private static int chunkOrder(ChunkHit hit) {
        try {
            return Integer.parseInt(hit.chunkId());
        }
        catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    private static String fileName(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    private static String metadataString(Map<String, Object> metadata, String key) {
        Object value = metadata.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }
}
