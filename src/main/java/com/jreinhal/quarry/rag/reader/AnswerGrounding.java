package com.jreinhal.quarry.rag.reader;

import com.jreinhal.quarry.util.TextTokens;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Cheap token-overlap checks around the generative fallback: whether a context is worth asking
 * about at all, and whether a generated answer is actually supported by it.
 */
@Component
public class AnswerGrounding {
    public static final double DEFAULT_GROUNDING_OVERLAP = 0.6;
    public static final double BEST_SENTENCE_OVERLAP = 0.5;

    public boolean likelyAnswerable(String context, String question, double minOverlap) {
        if (context == null || context.isBlank() || question == null || question.isBlank()) {
            return false;
        }
        Set<String> questionTokens = whitespaceTokens(question);
        Set<String> contextTokens = whitespaceTokens(context);
        int common = 0;
        for (String token : questionTokens) {
            if (!contextTokens.contains(token)) continue;
            ++common;
        }
        return (double)common / (double)Math.max(1, questionTokens.size()) >= minOverlap;
    }

    public boolean isGrounded(String answer, String context, double minOverlap) {
        if (answer == null || answer.isBlank() || context == null) {
            return false;
        }
        String lowerContext = context.toLowerCase(Locale.ROOT);
        if (lowerContext.contains(answer.strip().toLowerCase(Locale.ROOT))) {
            return true;
        }
        Set<String> answerTokens = TextTokens.tokens(answer);
        if (answerTokens.isEmpty()) {
            return false;
        }
        if (overlapRatio(answerTokens, TextTokens.tokens(context)) >= minOverlap) {
            return true;
        }
        for (String sentence : this.sentences(context)) {
            if (overlapRatio(answerTokens, TextTokens.tokens(sentence)) >= minOverlap) {
                return true;
            }
        }
        return false;
    }

    /**
     * The context sentence sharing the largest share of question tokens, if any shares one.
     */
    public Optional<String> bestSentence(String context, String question) {
        Set<String> questionTokens = TextTokens.tokens(question);
        String best = null;
        double bestScore = 0.0;
        for (String sentence : this.sentences(context)) {
            double score = overlapRatio(questionTokens, TextTokens.tokens(sentence));
            if (score <= bestScore) continue;
            bestScore = score;
            best = sentence;
        }
        return Optional.ofNullable(best);
    }

    private List<String> sentences(String context) {
        List<String> sentences = new ArrayList<String>();
        for (String line : ContextLines.lines(context)) {
            sentences.addAll(SentenceSplitter.splitSimple(line));
        }
        return sentences;
    }

    private static double overlapRatio(Set<String> reference, Set<String> other) {
        if (reference.isEmpty()) {
            return 0.0;
        }
        int shared = 0;
        for (String token : reference) {
            if (!other.contains(token)) continue;
            ++shared;
        }
        return (double)shared / (double)reference.size();
    }

    private static Set<String> whitespaceTokens(String text) {
        HashSet<String> tokens = new HashSet<String>();
        for (String token : text.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (token.isEmpty()) continue;
            tokens.add(token);
        }
        return tokens;
    }
}
