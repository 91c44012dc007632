package com.jreinhal.quarry.rag.diversify;

import com.jreinhal.quarry.model.Candidate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Hard cap on chunks per source file, preserving order, followed by a total ceiling.
 */
@Component
public class PerSourceCapFilter {
    public static final int DEFAULT_CAP = 5;

    public List<Candidate> apply(List<Candidate> candidates, int cap, int topk) {
        if (cap < 0) {
            throw new IllegalArgumentException("cap must be >= 0, got " + cap);
        }
        if (topk < 0) {
            throw new IllegalArgumentException("topk must be >= 0, got " + topk);
        }
        if (candidates == null || candidates.isEmpty() || topk == 0) {
            return List.of();
        }
        Map<String, Integer> perSource = new HashMap<String, Integer>();
        List<Candidate> kept = new ArrayList<Candidate>();
        for (Candidate candidate : candidates) {
            if (kept.size() >= topk) break;
            int seen = perSource.getOrDefault(candidate.getSourcePath(), 0);
            if (seen >= cap) continue;
            perSource.put(candidate.getSourcePath(), seen + 1);
            kept.add(candidate);
        }
        return kept;
    }
}
