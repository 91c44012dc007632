package com.jreinhal.quarry.rag.rerank;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.quarry.constant.StopWords;
import com.jreinhal.quarry.model.Candidate;
import com.jreinhal.quarry.model.ScoreComponent;
import com.jreinhal.quarry.util.LogSanitizer;
import com.jreinhal.quarry.util.TextTokens;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Optional second-stage rerank of the fused shortlist, run before diversification.
 *
 * <p>The first {@code input-topk} candidates are scored against the question, the raw scores are
 * min-max normalized, and each is blended with the candidate's fused score relative to the best one:</p>
 * <pre>
 * reranked = (alpha * scorer + (1 - alpha) * fused / maxFused) * hintBoost
 * </pre>
 * <p>{@code hintBoost} is {@value #DOC_HINT_BOOST} for chunks whose path contains the question's doc-hint
 * slug and 1 otherwise. The best {@code keep} candidates are returned in blend order; equal blends keep
 * fused order. A candidate whose scorer call fails is scored by keyword coverage instead.</p>
 */
@Component
public class ShortlistReranker {
    private static final Logger log = LoggerFactory.getLogger(ShortlistReranker.class);
    private static final Pattern SCORE_PATTERN = Pattern.compile("(0\\.\\d+|1\\.0|0|1)");
    private static final String SCORE_PROMPT = "Rate how well this passage answers the question on a scale of 0.0 to 1.0.\n\nQUESTION: %s\n\nPASSAGE:\n%s\n\nRespond with ONLY a number between 0.0 and 1.0.\n\nScore:";
    static final double DOC_HINT_BOOST = 4.0;
    static final int MAX_SCORED_CHARS = 1000;
    static final double PATH_TERM_BONUS = 0.1;
    private final ChatClient chatClient;
    private final ExecutorService executor;
    private final EmbeddingModel embeddingModel;
    @Value(value="${quarry.rerank.enabled:false}")
    private boolean enabled = false;
    @Value(value="${quarry.rerank.mode:auto}")
    private String mode = "auto";
    @Value(value="${quarry.rerank.input-topk:60}")
    private int inputTopK = 60;
    @Value(value="${quarry.rerank.keep:18}")
    private int keep = 18;
    @Value(value="${quarry.rerank.alpha:0.7}")
    private double alpha = 0.7;
    @Value(value="${quarry.rerank.batch-size:5}")
    private int batchSize = 5;
    @Value(value="${quarry.rerank.timeout-seconds:30}")
    private int timeoutSeconds = 30;
    @Value(value="${quarry.rerank.cache-size:2000}")
    private int cacheSize = 2000;
    @Value(value="${quarry.rerank.cache-ttl-seconds:900}")
    private long cacheTtlSeconds = 900L;
    private Cache<String, Double> scoreCache;

    public ShortlistReranker(ObjectProvider<ChatClient.Builder> chatClientBuilder, @Qualifier("rerankerExecutor") ExecutorService executor, ObjectProvider<EmbeddingModel> embeddingModel) {
        ChatClient.Builder builder = chatClientBuilder.getIfAvailable();
        this.chatClient = builder != null ? builder.build() : null;
        this.executor = executor;
        this.embeddingModel = embeddingModel.getIfAvailable();
    }

    @PostConstruct
    public void init() {
        if (this.cacheSize > 0 && this.cacheTtlSeconds > 0) {
            this.scoreCache = Caffeine.newBuilder()
                    .maximumSize(this.cacheSize)
                    .expireAfterWrite(Duration.ofSeconds(this.cacheTtlSeconds))
                    .build();
        }
        if (log.isInfoEnabled()) {
            log.info("Shortlist reranker initialized (enabled={}, mode={}, inputTopK={}, keep={}, embeddingModel={}, chatClient={})",
                    new Object[]{this.enabled, this.resolveMode(), this.inputTopK, this.keep, this.embeddingModel != null, this.chatClient != null});
        }
    }

    public boolean isEnabled() {
        return this.enabled;
    }

    public int getInputTopK() {
        return Math.max(1, this.inputTopK);
    }

    /**
     * Reranks the head of a fused shortlist. Returns the input unchanged when reranking is disabled.
     */
    public List<Candidate> rerank(String question, List<Candidate> candidates, Optional<String> docHint) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        if (!this.enabled || question == null || question.isBlank()) {
            return candidates;
        }
        long start = System.currentTimeMillis();
        List<Candidate> pool = new ArrayList<Candidate>(candidates.subList(0, Math.min(Math.max(1, this.inputTopK), candidates.size())));
        RerankMode resolved = this.resolveMode();
        double[] raw = this.score(resolved, question, pool);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double maxFused = 0.0;
        for (int i = 0; i < raw.length; ++i) {
            min = Math.min(min, raw[i]);
            max = Math.max(max, raw[i]);
            maxFused = Math.max(maxFused, pool.get(i).score(ScoreComponent.FUSED));
        }
        double range = max - min;
        String slug = docHint != null ? docHint.map(s -> s.toLowerCase(Locale.ROOT)).orElse(null) : null;
        for (int i = 0; i < pool.size(); ++i) {
            Candidate candidate = pool.get(i);
            double scorer = range > 1e-6 ? (raw[i] - min) / range : 0.0;
            double base = maxFused > 0.0 ? candidate.score(ScoreComponent.FUSED) / maxFused : 0.0;
            double boost = slug != null && candidate.getSourcePath().toLowerCase(Locale.ROOT).contains(slug) ? DOC_HINT_BOOST : 1.0;
            candidate.putScore(ScoreComponent.RERANKED, (this.alpha * scorer + (1.0 - this.alpha) * base) * boost);
        }
        pool.sort(Comparator.comparingDouble((Candidate c) -> c.score(ScoreComponent.RERANKED)).reversed());
        List<Candidate> kept = new ArrayList<Candidate>(pool.subList(0, Math.min(Math.max(1, this.keep), pool.size())));
        if (log.isDebugEnabled()) {
            log.debug("Reranked {} of {} candidates for {} (mode={}, kept={}) in {}ms",
                    new Object[]{pool.size(), candidates.size(), LogSanitizer.querySummary(question), resolved, kept.size(), System.currentTimeMillis() - start});
        }
        return kept;
    }

    RerankMode resolveMode() {
        String configured = this.mode != null ? this.mode.trim().toUpperCase(Locale.ROOT) : "";
        if (!configured.isEmpty() && !"AUTO".equals(configured)) {
            try {
                return RerankMode.valueOf(configured);
            }
            catch (IllegalArgumentException e) {
                log.warn("Unknown rerank mode '{}'; using auto", LogSanitizer.sanitize(this.mode));
            }
        }
        if (this.embeddingModel != null) {
            return RerankMode.EMBEDDING;
        }
        return this.chatClient != null ? RerankMode.LLM : RerankMode.KEYWORD;
    }

    private double[] score(RerankMode resolved, String question, List<Candidate> pool) {
        switch (resolved) {
            case EMBEDDING:
                return this.scoreWithEmbeddings(question, pool);
            case LLM:
                return this.scoreWithLlm(question, pool);
            default:
                double[] scores = new double[pool.size()];
                for (int i = 0; i < pool.size(); ++i) {
                    scores[i] = this.keywordScore(question, pool.get(i));
                }
                return scores;
        }
    }

    private double[] scoreWithEmbeddings(String question, List<Candidate> pool) {
        double[] scores = new double[pool.size()];
        float[] questionVector = this.embeddingModel != null ? this.safeEmbed(question) : new float[0];
        for (int i = 0; i < pool.size(); ++i) {
            Candidate candidate = pool.get(i);
            if (questionVector.length == 0) {
                scores[i] = this.keywordScore(question, candidate);
                continue;
            }
            String cacheKey = cacheKey(RerankMode.EMBEDDING, question, candidate);
            Double cached = this.cached(cacheKey);
            if (cached != null) {
                scores[i] = cached;
                continue;
            }
            float[] passageVector = this.safeEmbed(scoredText(candidate));
            if (passageVector.length != questionVector.length) {
                scores[i] = this.keywordScore(question, candidate);
                continue;
            }
            scores[i] = Math.max(0.0, Math.min(1.0, (cosine(questionVector, passageVector) + 1.0) / 2.0));
            this.remember(cacheKey, scores[i]);
        }
        return scores;
    }

    private double[] scoreWithLlm(String question, List<Candidate> pool) {
        double[] scores = new double[pool.size()];
        if (this.chatClient == null) {
            for (int i = 0; i < pool.size(); ++i) {
                scores[i] = this.keywordScore(question, pool.get(i));
            }
            return scores;
        }
        boolean saturated = false;
        int size = Math.max(1, this.batchSize);
        for (int from = 0; from < pool.size(); from += size) {
            int to = Math.min(from + size, pool.size());
            List<Future<Double>> futures = new ArrayList<Future<Double>>(to - from);
            for (int i = from; i < to; ++i) {
                Candidate candidate = pool.get(i);
                if (saturated) {
                    futures.add(null);
                    continue;
                }
                try {
                    futures.add(this.executor.submit(() -> this.llmScore(question, candidate)));
                }
                catch (RejectedExecutionException e) {
                    log.warn("Rerank pool saturated; remaining candidates use keyword scores: {}", e.getMessage());
                    saturated = true;
                    futures.add(null);
                }
            }
            for (int i = from; i < to; ++i) {
                Future<Double> future = futures.get(i - from);
                scores[i] = future != null ? this.awaitScore(future, question, pool.get(i)) : this.keywordScore(question, pool.get(i));
            }
        }
        return scores;
    }

    private double awaitScore(Future<Double> future, String question, Candidate candidate) {
        try {
            return future.get(this.timeoutSeconds, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return this.keywordScore(question, candidate);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Rerank scoring timed out after {}s for {}", this.timeoutSeconds, candidate.key());
            return this.keywordScore(question, candidate);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Rerank scoring failed for {}: {}", candidate.key(), LogSanitizer.sanitize(cause.getMessage()));
            return this.keywordScore(question, candidate);
        }
    }

    private double llmScore(String question, Candidate candidate) {
        String cacheKey = cacheKey(RerankMode.LLM, question, candidate);
        Double cached = this.cached(cacheKey);
        if (cached != null) {
            return cached;
        }
        String response = this.chatClient.prompt().user(String.format(SCORE_PROMPT, question, scoredText(candidate))).call().content();
        double score = parseScore(response);
        this.remember(cacheKey, score);
        return score;
    }

    double keywordScore(String question, Candidate candidate) {
        String cacheKey = cacheKey(RerankMode.KEYWORD, question, candidate);
        Double cached = this.cached(cacheKey);
        if (cached != null) {
            return cached;
        }
        Set<String> terms = TextTokens.tokens(question, StopWords.CHANNEL_KEYWORDS);
        terms.removeIf(term -> term.length() <= 2);
        double score = 0.0;
        if (!terms.isEmpty()) {
            Set<String> passage = TextTokens.tokens(candidate.resolvedText());
            String path = candidate.getSourcePath().toLowerCase(Locale.ROOT);
            int matched = 0;
            for (String term : terms) {
                if (passage.contains(term)) {
                    ++matched;
                }
                if (path.contains(term)) {
                    score += PATH_TERM_BONUS;
                }
            }
            score = Math.min(1.0, score + (double)matched / (double)terms.size());
        }
        this.remember(cacheKey, score);
        return score;
    }

    static double parseScore(String response) {
        if (response == null || response.isBlank()) {
            return 0.5;
        }
        Matcher matcher = SCORE_PATTERN.matcher(response.trim());
        if (matcher.find()) {
            return Math.max(0.0, Math.min(1.0, Double.parseDouble(matcher.group(1))));
        }
        return 0.5;
    }

    static double cosine(float[] a, float[] b) {
        if (a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; ++i) {
            dot += (double)a[i] * (double)b[i];
            normA += (double)a[i] * (double)a[i];
            normB += (double)b[i] * (double)b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private float[] safeEmbed(String text) {
        if (text == null || text.isBlank()) {
            return new float[0];
        }
        try {
            float[] vector = this.embeddingModel.embed(text);
            return vector != null ? vector : new float[0];
        }
        catch (RuntimeException e) {
            if (log.isDebugEnabled()) {
                log.debug("Rerank embedding failed, using keyword score: {}", e.getMessage());
            }
            return new float[0];
        }
    }

    private Double cached(String cacheKey) {
        return this.scoreCache != null ? this.scoreCache.getIfPresent(cacheKey) : null;
    }

    private void remember(String cacheKey, double score) {
        if (this.scoreCache != null) {
            this.scoreCache.put(cacheKey, score);
        }
    }

    static String cacheKey(RerankMode mode, String question, Candidate candidate) {
        return mode + "|" + question + "|" + candidate.key() + "|" + candidate.resolvedText().hashCode();
    }

    private static String scoredText(Candidate candidate) {
        String text = candidate.resolvedText();
        return text.length() > MAX_SCORED_CHARS ? text.substring(0, MAX_SCORED_CHARS) + "..." : text;
    }

    enum RerankMode {
        EMBEDDING,
        LLM,
        KEYWORD
    }
}
