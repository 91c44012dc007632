package com.jreinhal.quarry.rag.diversify;

import com.jreinhal.quarry.model.Candidate;
import com.jreinhal.quarry.model.ScoreComponent;
import com.jreinhal.quarry.util.TextTokens;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maximal Marginal Relevance reordering of a fused shortlist.
 *
 * <p>Each step selects the remaining candidate maximizing
 * {@code alpha * relevance - (1 - alpha) * maxSimilarity - perFilePenalty * sameFileSelected}.
 * Relevance is {@link Candidate#relevance()} scaled by the best relevance in the input; similarity
 * is the Jaccard overlap of resolved-text tokens. Equal objectives keep input order, so the output
 * is deterministic for identical inputs.</p>
 */
@Component
public class MmrDiversifier {
    private static final Logger log = LoggerFactory.getLogger(MmrDiversifier.class);

    public List<Candidate> diversify(List<Candidate> candidates, MmrSettings settings, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must be >= 0, got " + k);
        }
        if (candidates == null || candidates.isEmpty() || k == 0) {
            return List.of();
        }
        MmrSettings effective = settings != null ? settings : MmrSettings.DEFAULT;
        int n = candidates.size();
        double maxScore = 0.0;
        for (Candidate candidate : candidates) {
            maxScore = Math.max(maxScore, candidate.relevance());
        }
        double[] relevance = new double[n];
        List<Set<String>> tokenSets = new ArrayList<Set<String>>(n);
        for (int i = 0; i < n; ++i) {
            Candidate candidate = candidates.get(i);
            relevance[i] = maxScore > 0.0 ? candidate.relevance() / maxScore : 0.0;
            tokenSets.add(TextTokens.tokens(candidate.resolvedText()));
        }
        double[] maxSimilarity = new double[n];
        boolean[] selected = new boolean[n];
        Map<String, Integer> perFile = new HashMap<String, Integer>();
        int target = Math.min(k, n);
        List<Candidate> result = new ArrayList<Candidate>(target);
        while (result.size() < target) {
            int best = -1;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < n; ++i) {
                if (selected[i]) continue;
                int sameFile = perFile.getOrDefault(candidates.get(i).getSourcePath(), 0);
                double score = effective.alpha() * relevance[i]
                        - (1.0 - effective.alpha()) * maxSimilarity[i]
                        - effective.perFilePenalty() * sameFile;
                if (score > bestScore) {
                    bestScore = score;
                    best = i;
                }
            }
            selected[best] = true;
            Candidate chosen = candidates.get(best);
            chosen.putScore(ScoreComponent.DIVERSIFIED, bestScore);
            result.add(chosen);
            perFile.merge(chosen.getSourcePath(), 1, Integer::sum);
            Set<String> chosenTokens = tokenSets.get(best);
            for (int i = 0; i < n; ++i) {
                if (selected[i]) continue;
                maxSimilarity[i] = Math.max(maxSimilarity[i], TextTokens.jaccard(chosenTokens, tokenSets.get(i)));
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("MMR selected {} of {} candidates (alpha={}, perFilePenalty={})", new Object[]{result.size(), n, effective.alpha(), effective.perFilePenalty()});
        }
        return result;
    }
}
