package com.jreinhal.quarry.rag.reader;

import com.jreinhal.quarry.QueryTag;
import com.jreinhal.quarry.constant.StopWords;
import com.jreinhal.quarry.model.Candidate;
import com.jreinhal.quarry.model.ContextBundle;
import com.jreinhal.quarry.model.SentencePick;
import com.jreinhal.quarry.util.TextTokens;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the compact reader context: every candidate is split into sentences, each sentence is
 * scored against the question, the best {@code perChunk} per candidate are pooled and the best
 * {@code total} overall are emitted as {@code [source#chunk:id] sentence} lines.
 *
 * <pre>
 * score = (overlap + phrase + file + sql + cmd + idx + tag) * firstLine
 * overlap = |S ∩ Q| / max(1, sqrt(|S|))
 * </pre>
 */
@Component
public class ExtractiveContextAssembler {
    private static final Logger log = LoggerFactory.getLogger(ExtractiveContextAssembler.class);
    static final double PHRASE_BONUS = 0.4;
    static final double FILE_BONUS = 0.2;
    static final double SQL_BONUS = 0.35;
    static final double COMMAND_BONUS = 0.10;
    static final double INDEX_BONUS = 0.05;
    static final double TAG_BONUS = 0.20;
    static final double FIRST_LINE_MULTIPLIER = 1.15;
    private static final Set<String> INDEX_METHODS = Set.of("gin", "gist", "ivfflat", "hnsw");
    private static final Comparator<SentencePick> BY_RANK = Comparator.comparingDouble(SentencePick::rankKey).reversed();

    public ContextBundle assemble(List<Candidate> candidates, String question, QueryTag tag, List<String> phraseHints, ReaderSettings settings) {
        if (candidates == null || candidates.isEmpty()) {
            return ContextBundle.empty();
        }
        ReaderSettings effective = settings != null ? settings : ReaderSettings.DEFAULT;
        if (effective.perChunk() == 0 || effective.total() == 0) {
            return ContextBundle.empty();
        }
        Set<String> queryTokens = TextTokens.tokens(question, StopWords.READER);
        List<String> hints = normalizeHints(phraseHints);
        QueryTag effectiveTag = tag != null ? tag : QueryTag.GENERAL;
        List<SentencePick> pool = new ArrayList<SentencePick>();
        for (Candidate candidate : candidates) {
            pool.addAll(this.pickFromCandidate(candidate, queryTokens, hints, effectiveTag, effective.perChunk()));
        }
        pool.sort(BY_RANK);
        StringBuilder text = new StringBuilder();
        List<SentencePick> emitted = new ArrayList<SentencePick>();
        for (SentencePick pick : pool) {
            if (emitted.size() >= effective.total()) break;
            String line = pick.annotatedLine();
            int projected = text.length() + (text.length() > 0 ? 1 : 0) + line.length();
            if (projected > effective.maxChars()) continue;
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(line);
            emitted.add(pick);
        }
        if (log.isDebugEnabled()) {
            log.debug("Context assembled: {} candidates, {} pooled sentences, {} emitted, {} chars", new Object[]{candidates.size(), pool.size(), emitted.size(), text.length()});
        }
        return new ContextBundle(text.toString(), emitted);
    }

    private List<SentencePick> pickFromCandidate(Candidate candidate, Set<String> queryTokens, List<String> hints, QueryTag tag, int perChunk) {
        String text = candidate.resolvedText();
        List<String> sentences = SentenceSplitter.split(text);
        if (sentences.isEmpty()) {
            return List.of();
        }
        String firstLine = SentenceSplitter.firstLine(text);
        Set<String> fileTokens = fileTokens(candidate.getSourcePath());
        double candidateScore = candidate.retrievalScore();
        List<SentencePick> picks = new ArrayList<SentencePick>(sentences.size());
        for (int i = 0; i < sentences.size(); ++i) {
            String sentence = sentences.get(i);
            boolean isFirstLine = i == 0 && sentence.equals(firstLine);
            double score = scoreSentence(sentence, queryTokens, hints, fileTokens, tag, isFirstLine);
            picks.add(new SentencePick(candidate.getSourcePath(), candidate.getChunkId(), sentence, score, candidateScore));
        }
        picks.sort(BY_RANK);
        return picks.size() > perChunk ? new ArrayList<SentencePick>(picks.subList(0, perChunk)) : picks;
    }

    static double scoreSentence(String sentence, Set<String> queryTokens, List<String> hints, Set<String> fileTokens, QueryTag tag, boolean isFirstLine) {
        Set<String> sentenceTokens = TextTokens.tokens(sentence);
        int shared = 0;
        for (String token : sentenceTokens) {
            if (!queryTokens.contains(token)) continue;
            ++shared;
        }
        double overlap = (double)shared / Math.max(1.0, Math.sqrt(sentenceTokens.size()));
        String lower = sentence.toLowerCase(Locale.ROOT);
        double bonus = 0.0;
        for (String hint : hints) {
            if (!lower.contains(hint)) continue;
            bonus += PHRASE_BONUS;
            break;
        }
        for (String token : fileTokens) {
            if (!sentenceTokens.contains(token)) continue;
            bonus += FILE_BONUS;
            break;
        }
        if (SchemaPatterns.containsCodeFence(sentence) || SchemaPatterns.containsSchemaKeyword(sentence)) {
            bonus += SQL_BONUS;
        }
        if (SchemaPatterns.startsWithCommandVerb(sentence)) {
            bonus += COMMAND_BONUS;
        }
        for (String method : INDEX_METHODS) {
            if (!sentenceTokens.contains(method)) continue;
            bonus += INDEX_BONUS;
            break;
        }
        for (String token : tag.getBonusTokens()) {
            if (!sentenceTokens.contains(token)) continue;
            bonus += TAG_BONUS;
            break;
        }
        double multiplier = isFirstLine && SchemaPatterns.startsWithDefinitionVerb(sentence) ? FIRST_LINE_MULTIPLIER : 1.0;
        return (overlap + bonus) * multiplier;
    }

    static Set<String> fileTokens(String sourcePath) {
        if (sourcePath == null || sourcePath.isBlank()) {
            return Set.of();
        }
        int slash = Math.max(sourcePath.lastIndexOf('/'), sourcePath.lastIndexOf('\\'));
        String name = slash >= 0 ? sourcePath.substring(slash + 1) : sourcePath;
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        LinkedHashSet<String> tokens = new LinkedHashSet<String>();
        for (String token : TextTokens.tokenList(stem.replace('_', ' ').replace('-', ' ').replace('.', ' '))) {
            if (token.length() < 3 || token.chars().allMatch(Character::isDigit)) continue;
            tokens.add(token);
        }
        return tokens;
    }

    private static List<String> normalizeHints(List<String> phraseHints) {
        if (phraseHints == null || phraseHints.isEmpty()) {
            return List.of();
        }
        List<String> hints = new ArrayList<String>();
        for (String hint : phraseHints) {
            if (hint == null || hint.isBlank()) continue;
            hints.add(hint.trim().toLowerCase(Locale.ROOT));
        }
        return hints;
    }
}
