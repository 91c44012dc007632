package com.jreinhal.quarry.service;

import com.jreinhal.quarry.QueryTag;
import com.jreinhal.quarry.exception.InvalidQueryException;
import com.jreinhal.quarry.model.Answer;
import com.jreinhal.quarry.model.AnswerSource;
import com.jreinhal.quarry.model.Candidate;
import com.jreinhal.quarry.model.ChannelQuerySet;
import com.jreinhal.quarry.model.ContextBundle;
import com.jreinhal.quarry.model.ReaderResult;
import com.jreinhal.quarry.rag.channel.QueryChannelBuilder;
import com.jreinhal.quarry.rag.diversify.MmrDiversifier;
import com.jreinhal.quarry.rag.diversify.MmrSettings;
import com.jreinhal.quarry.rag.diversify.PerSourceCapFilter;
import com.jreinhal.quarry.rag.fusion.HybridRetrievalFuser;
import com.jreinhal.quarry.rag.limits.TagLimits;
import com.jreinhal.quarry.rag.limits.TagLimitsProvider;
import com.jreinhal.quarry.rag.reader.AnswerGrounding;
import com.jreinhal.quarry.rag.reader.AnswerNormalizer;
import com.jreinhal.quarry.rag.reader.DeterministicSpanExtractor;
import com.jreinhal.quarry.rag.reader.ExtractiveContextAssembler;
import com.jreinhal.quarry.rag.reader.ReaderSettings;
import com.jreinhal.quarry.rag.rerank.ShortlistReranker;
import com.jreinhal.quarry.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs one question through the whole reader: channel building, fused retrieval, the optional rerank,
 * diversification, per-source capping, context assembly and finally the rule-first answer step.
 *
 * <p>Deterministic span extraction always wins over the generative fallback; the fallback is only
 * consulted when no rule fires and the context looks answerable.</p>
 */
@Service
public class ReaderPipelineService {
    private static final Logger log = LoggerFactory.getLogger(ReaderPipelineService.class);
    private final QueryChannelBuilder channelBuilder;
    private final HybridRetrievalFuser fuser;
    private final ShortlistReranker reranker;
    private final MmrDiversifier diversifier;
    private final PerSourceCapFilter capFilter;
    private final TagLimitsProvider limitsProvider;
    private final ExtractiveContextAssembler assembler;
    private final DeterministicSpanExtractor spanExtractor;
    private final AnswerNormalizer normalizer;
    private final AnswerGrounding grounding;
    private final GenerativeFallback fallback;
    @Value(value="${quarry.mmr.alpha:0.85}")
    private double mmrAlpha = 0.85;
    @Value(value="${quarry.mmr.per-file-penalty:0.10}")
    private double mmrPerFilePenalty = 0.10;
    @Value(value="${quarry.reader.per-file-cap:5}")
    private int perFileCap = 5;
    @Value(value="${quarry.reader.docs-budget:10}")
    private int docsBudget = 10;
    @Value(value="${quarry.reader.sentences-per-chunk:2}")
    private int sentencesPerChunk = 2;
    @Value(value="${quarry.reader.total-sentences:10}")
    private int totalSentences = 10;
    @Value(value="${quarry.reader.max-chars:6000}")
    private int maxChars = 6000;
    @Value(value="${quarry.reader.precheck.enabled:true}")
    private boolean precheckEnabled = true;
    @Value(value="${quarry.reader.precheck.min-overlap:0.18}")
    private double precheckMinOverlap = 0.18;
    @Value(value="${quarry.reader.enforce-span:true}")
    private boolean enforceSpan = true;

    public ReaderPipelineService(QueryChannelBuilder channelBuilder, HybridRetrievalFuser fuser, ShortlistReranker reranker, MmrDiversifier diversifier, PerSourceCapFilter capFilter, TagLimitsProvider limitsProvider, ExtractiveContextAssembler assembler, DeterministicSpanExtractor spanExtractor, AnswerNormalizer normalizer, AnswerGrounding grounding, GenerativeFallback fallback) {
        this.channelBuilder = channelBuilder;
        this.fuser = fuser;
        this.reranker = reranker;
        this.diversifier = diversifier;
        this.capFilter = capFilter;
        this.limitsProvider = limitsProvider;
        this.assembler = assembler;
        this.spanExtractor = spanExtractor;
        this.normalizer = normalizer;
        this.grounding = grounding;
        this.fallback = fallback;
    }

    @PostConstruct
    public void init() {
        log.info("Reader pipeline initialized (perFileCap={}, docsBudget={}, precheck={}, enforceSpan={}, rerank={})", new Object[]{this.perFileCap, this.docsBudget, this.precheckEnabled, this.enforceSpan, this.reranker.isEnabled()});
    }

    public ReaderResult answer(String question, String tagLabel) {
        if (question == null || question.isBlank()) {
            throw new InvalidQueryException("Question must not be blank");
        }
        QueryTag tag;
        try {
            tag = QueryTag.fromLabel(tagLabel);
        }
        catch (IllegalArgumentException e) {
            throw new InvalidQueryException("Unknown query tag: " + LogSanitizer.sanitize(tagLabel), e);
        }
        long start = System.currentTimeMillis();
        TagLimits limits = this.limitsProvider.limitsFor(tag);
        ChannelQuerySet channels = this.channelBuilder.build(question, tag);
        boolean rerank = this.reranker.isEnabled();
        int poolSize = rerank ? Math.max(limits.shortlistSize(), this.reranker.getInputTopK()) : limits.shortlistSize();
        List<Candidate> shortlist = this.fuser.retrieve(channels, tag, poolSize, true);
        List<Candidate> ranked = rerank ? this.reranker.rerank(question, shortlist, channels.docHint()) : shortlist;
        List<Candidate> diversified = this.diversifier.diversify(ranked, new MmrSettings(this.mmrAlpha, this.mmrPerFilePenalty), limits.shortlistSize());
        int ctxCap = Math.max(1, Math.min(this.docsBudget, limits.topk()));
        int cap = Math.max(1, Math.min(this.perFileCap, ctxCap));
        List<Candidate> used = this.capFilter.apply(diversified, cap, ctxCap);
        ContextBundle context = this.assembler.assemble(used, question, tag, channels.phraseHints(), new ReaderSettings(this.sentencesPerChunk, this.totalSentences, this.maxChars));
        Answer answer = this.read(context, question, tag);
        if (log.isInfoEnabled()) {
            log.info("Reader answered {} (shortlist={}, reranked={}, used={}, source={}) in {}ms", new Object[]{LogSanitizer.querySummary(question, tag), shortlist.size(), rerank ? ranked.size() : 0, used.size(), answer.source(), System.currentTimeMillis() - start});
        }
        return new ReaderResult(answer, context, used);
    }

    private Answer read(ContextBundle context, String question, QueryTag tag) {
        Optional<String> span = this.spanExtractor.extract(context.text(), question, tag);
        if (span.isPresent()) {
            return new Answer(this.normalizer.normalize(span.get(), tag), AnswerSource.RULE_EXTRACTED);
        }
        if (this.precheckEnabled && !this.grounding.likelyAnswerable(context.text(), question, this.precheckMinOverlap)) {
            log.debug("Precheck rejected context; abstaining");
            return abstain();
        }
        Optional<String> generated = this.fallback.generate(context.text(), question);
        if (generated.isEmpty()) {
            return abstain();
        }
        String text = generated.get();
        if (this.enforceSpan && !this.grounding.isGrounded(text, context.text(), AnswerGrounding.DEFAULT_GROUNDING_OVERLAP)) {
            Optional<String> sentence = this.grounding.bestSentence(context.text(), question).filter(s -> this.grounding.isGrounded(s, context.text(), AnswerGrounding.BEST_SENTENCE_OVERLAP));
            if (sentence.isEmpty()) {
                log.debug("Generated answer not grounded in context; abstaining");
                return abstain();
            }
            text = sentence.get();
        }
        String normalized = this.normalizer.normalize(text, tag);
        if (AnswerNormalizer.UNKNOWN.equals(normalized)) {
            return abstain();
        }
        return new Answer(normalized, AnswerSource.GENERATIVE_FALLBACK);
    }

    private static Answer abstain() {
        return new Answer(AnswerNormalizer.UNKNOWN, AnswerSource.ABSTAINED);
    }
}
