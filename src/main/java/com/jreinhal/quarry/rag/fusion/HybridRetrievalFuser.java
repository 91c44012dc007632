package com.jreinhal.quarry.rag.fusion;

import com.jreinhal.quarry.QueryTag;
import com.jreinhal.quarry.exception.InvalidQueryException;
import com.jreinhal.quarry.exception.RetrievalException;
import com.jreinhal.quarry.model.Candidate;
import com.jreinhal.quarry.model.ChannelQuerySet;
import com.jreinhal.quarry.model.ChunkHit;
import com.jreinhal.quarry.model.DenseQuery;
import com.jreinhal.quarry.model.ScoreComponent;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues the channel queries against the chunk store concurrently and merges them into one ranked shortlist.
 *
 * <p>A channel that fails or misses the shared deadline fails the whole call; partial
 * channel results are never fused. Reads still running at that point are cancelled with
 * interruption, so a store that honours interrupts frees its pool thread.</p>
 */
@Service
public class HybridRetrievalFuser {
    private static final Logger log = LoggerFactory.getLogger(HybridRetrievalFuser.class);
    private static final int MAX_POOL = 500;
    private static final String DOC_HINT = "DOC_HINT";
    private static final Set<ScoreComponent> FUSED_ONLY = EnumSet.of(ScoreComponent.FUSED, ScoreComponent.PRIOR);
    static final Comparator<Candidate> RANKING = Comparator
            .comparingDouble((Candidate c) -> c.score(ScoreComponent.FUSED)).reversed()
            .thenComparing(Comparator.comparingDouble((Candidate c) -> c.score(ScoreComponent.LEXICAL)).reversed())
            .thenComparing(Candidate::getSourcePath)
            .thenComparing(Candidate::getChunkId);
    private final ChunkStore chunkStore;
    private final ExecutorService retrievalExecutor;
    @Value(value="${quarry.retrieval.timeout-ms:8000}")
    private long timeoutMs = 8000L;
    @Value(value="${quarry.retrieval.pool-multiplier:2}")
    private int poolMultiplier = 2;
    @Value(value="${quarry.retrieval.hint-prefetch-limit:8}")
    private int hintPrefetchLimit = 8;
    @Value(value="${quarry.retrieval.weights.short:0.20}")
    private double shortWeight = 0.20;
    @Value(value="${quarry.retrieval.weights.title:0.15}")
    private double titleWeight = 0.15;
    @Value(value="${quarry.retrieval.weights.lexical:0.35}")
    private double lexicalWeight = 0.35;
    @Value(value="${quarry.retrieval.weights.vector:0.30}")
    private double vectorWeight = 0.30;
    @Value(value="${quarry.retrieval.lambda-lex:0.6}")
    private double lambdaLex = 0.6;
    @Value(value="${quarry.retrieval.lambda-sem:0.4}")
    private double lambdaSem = 0.4;

    public HybridRetrievalFuser(ChunkStore chunkStore, @Qualifier("retrievalExecutor") ExecutorService retrievalExecutor) {
        this.chunkStore = chunkStore;
        this.retrievalExecutor = retrievalExecutor;
    }

    @PostConstruct
    public void init() {
        log.info("Hybrid retrieval fuser initialized (timeoutMs={}, poolMultiplier={}, lambdaLex={}, lambdaSem={})", new Object[]{this.timeoutMs, this.poolMultiplier, this.lambdaLex, this.lambdaSem});
    }

    /**
     * Retrieves and fuses candidates for one question.
     *
     * @param retainComponents keep the per-channel component scores on each candidate
     * @throws InvalidQueryException if the channel set is empty
     * @throws RetrievalException if any channel read fails, is rejected or misses the deadline
     */
    public List<Candidate> retrieve(ChannelQuerySet channels, QueryTag tag, int shortlistSize, boolean retainComponents) {
        if (channels == null || channels.isEmpty()) {
            throw new InvalidQueryException("Channel query set is empty; blank questions must be rejected before retrieval");
        }
        if (shortlistSize < 1) {
            throw new IllegalArgumentException("shortlistSize must be >= 1, got " + shortlistSize);
        }
        long startTime = System.currentTimeMillis();
        int perChannel = Math.min(MAX_POOL, shortlistSize * Math.max(1, this.poolMultiplier));
        Map<RetrievalChannel, Future<List<ChunkHit>>> futures = new EnumMap<RetrievalChannel, Future<List<ChunkHit>>>(RetrievalChannel.class);
        List<Future<List<ChunkHit>>> inFlight = new ArrayList<Future<List<ChunkHit>>>();
        Future<List<ChunkHit>> prefetch = null;
        this.submitText(futures, inFlight, RetrievalChannel.SHORT, channels.shortQuery(), tag, perChannel);
        this.submitText(futures, inFlight, RetrievalChannel.TITLE, channels.titleQuery(), tag, perChannel);
        this.submitText(futures, inFlight, RetrievalChannel.LEXICAL, channels.lexicalQuery(), tag, perChannel);
        if (channels.dense().isPresent()) {
            DenseQuery dense = channels.dense().get();
            futures.put(RetrievalChannel.VECTOR, this.submit(RetrievalChannel.VECTOR.name(), () -> this.chunkStore.searchDense(dense, tag, perChannel), inFlight));
        }
        if (channels.docHint().isPresent() && this.hintPrefetchLimit > 0) {
            String slug = channels.docHint().get();
            prefetch = this.submit(DOC_HINT, () -> this.chunkStore.fetchByDocSlug(slug, this.hintPrefetchLimit), inFlight);
        }
        long deadline = startTime + this.timeoutMs;
        Map<RetrievalChannel, List<ChunkHit>> results = new EnumMap<RetrievalChannel, List<ChunkHit>>(RetrievalChannel.class);
        for (Map.Entry<RetrievalChannel, Future<List<ChunkHit>>> entry : futures.entrySet()) {
            results.put(entry.getKey(), this.await(entry.getValue(), deadline, entry.getKey().name(), inFlight));
        }
        List<ChunkHit> prefetched = prefetch != null ? this.await(prefetch, deadline, DOC_HINT, inFlight) : List.of();
        List<Candidate> fused = this.fuse(results, prefetched, shortlistSize, retainComponents);
        long elapsed = System.currentTimeMillis() - startTime;
        int rawHits = results.values().stream().mapToInt(List::size).sum();
        log.info("Fused retrieval: {} channels, {} hits, {} prefetched, {} shortlisted in {}ms", new Object[]{results.size(), rawHits, prefetched.size(), fused.size(), elapsed});
        return fused;
    }

    FusionWeights weights() {
        return new FusionWeights(this.shortWeight, this.titleWeight, this.lexicalWeight, this.vectorWeight, this.lambdaLex, this.lambdaSem);
    }

    private void submitText(Map<RetrievalChannel, Future<List<ChunkHit>>> futures, List<Future<List<ChunkHit>>> inFlight, RetrievalChannel channel, String query, QueryTag tag, int limit) {
        if (query == null || query.isBlank()) {
            return;
        }
        futures.put(channel, this.submit(channel.name(), () -> this.chunkStore.searchText(channel, query, tag, limit), inFlight));
    }

    private Future<List<ChunkHit>> submit(String readName, Callable<List<ChunkHit>> read, List<Future<List<ChunkHit>>> inFlight) {
        try {
            Future<List<ChunkHit>> future = this.retrievalExecutor.submit(read);
            inFlight.add(future);
            return future;
        }
        catch (RejectedExecutionException e) {
            cancelAll(inFlight);
            throw new RetrievalException("Retrieval pool rejected the " + readName + " read: " + e.getMessage(), e);
        }
    }

    private List<ChunkHit> await(Future<List<ChunkHit>> future, long deadline, String channelName, List<Future<List<ChunkHit>>> inFlight) {
        long remainingMs = deadline - System.currentTimeMillis();
        if (remainingMs <= 0L) {
            cancelAll(inFlight);
            throw new RetrievalException("Chunk store query exceeded " + this.timeoutMs + "ms before channel " + channelName + " returned");
        }
        try {
            List<ChunkHit> hits = future.get(remainingMs, TimeUnit.MILLISECONDS);
            return hits != null ? hits : List.of();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(inFlight);
            throw new RetrievalException("Retrieval interrupted while waiting for channel " + channelName, e);
        }
        catch (TimeoutException e) {
            cancelAll(inFlight);
            throw new RetrievalException("Chunk store query timed out after " + this.timeoutMs + "ms on channel " + channelName, e);
        }
        catch (ExecutionException e) {
            cancelAll(inFlight);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new RetrievalException("Chunk store query failed on channel " + channelName + ": " + cause.getMessage(), cause);
        }
    }

    private List<Candidate> fuse(Map<RetrievalChannel, List<ChunkHit>> results, List<ChunkHit> prefetched, int shortlistSize, boolean retainComponents) {
        Map<RetrievalChannel, Double> weights = this.weights().scaled(results.containsKey(RetrievalChannel.VECTOR));
        LinkedHashMap<String, Candidate> byKey = new LinkedHashMap<String, Candidate>();
        for (Map.Entry<RetrievalChannel, List<ChunkHit>> entry : results.entrySet()) {
            ScoreComponent component = entry.getKey().getComponent();
            double max = entry.getValue().stream().mapToDouble(ChunkHit::score).max().orElse(0.0);
            for (ChunkHit hit : entry.getValue()) {
                Candidate candidate = byKey.computeIfAbsent(hit.key(), k -> Candidate.fromHit(hit));
                double normalized = max > 0.0 ? hit.score() / max : 0.0;
                if (candidate.hasScore(component) && candidate.score(component) >= normalized) continue;
                candidate.putScore(component, normalized);
            }
        }
        for (Candidate candidate : byKey.values()) {
            double weighted = 0.0;
            for (RetrievalChannel channel : results.keySet()) {
                if (!candidate.hasScore(channel.getComponent())) {
                    candidate.putScore(channel.getComponent(), 0.0);
                }
                weighted += weights.getOrDefault(channel, 0.0) * candidate.score(channel.getComponent());
            }
            double prior = SourcePrior.prior(candidate.getSourcePath(), candidate.resolvedText());
            candidate.putScore(ScoreComponent.PRIOR, prior);
            candidate.putScore(ScoreComponent.FUSED, weighted * SourcePrior.multiplier(prior));
        }
        List<Candidate> ranked = new ArrayList<Candidate>(byKey.values());
        ranked.sort(RANKING);
        double topFused = ranked.isEmpty() ? 0.0 : ranked.get(0).score(ScoreComponent.FUSED);

        LinkedHashSet<String> pinnedKeys = new LinkedHashSet<String>();
        List<Candidate> shortlist = new ArrayList<Candidate>();
        for (ChunkHit hit : prefetched) {
            if (pinnedKeys.size() >= this.hintPrefetchLimit || shortlist.size() >= shortlistSize) break;
            if (!pinnedKeys.add(hit.key())) continue;
            Candidate candidate = byKey.get(hit.key());
            if (candidate == null) {
                candidate = Candidate.fromHit(hit);
                double prior = SourcePrior.prior(candidate.getSourcePath(), candidate.resolvedText());
                candidate.putScore(ScoreComponent.PRIOR, prior);
            }
            candidate.putScore(ScoreComponent.FUSED, Math.max(candidate.score(ScoreComponent.FUSED), topFused));
            shortlist.add(candidate);
        }
        for (Candidate candidate : ranked) {
            if (shortlist.size() >= shortlistSize) break;
            if (pinnedKeys.contains(candidate.key())) continue;
            shortlist.add(candidate);
        }
        if (!retainComponents) {
            for (Candidate candidate : shortlist) {
                candidate.retainScores(FUSED_ONLY);
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Fusion weights {} over {} unique chunks; top={}", new Object[]{weights, byKey.size(), shortlist.isEmpty() ? "none" : shortlist.get(0).key()});
        }
        return shortlist;
    }

    private static void cancelAll(List<Future<List<ChunkHit>>> futures) {
        for (Future<List<ChunkHit>> future : futures) {
            future.cancel(true);
        }
    }
}
