package com.jreinhal.quarry.rag.diversify;

import com.jreinhal.quarry.model.Candidate;
import com.jreinhal.quarry.model.ChunkText;
import com.jreinhal.quarry.model.ScoreComponent;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MmrDiversifierTest {
    private final MmrDiversifier diversifier = new MmrDiversifier();

    private static Candidate candidate(String path, String chunkId, String text, double fused) {
        Candidate candidate = new Candidate(path, chunkId, ChunkText.ofContent(text));
        candidate.putScore(ScoreComponent.FUSED, fused);
        return candidate;
    }

    private static List<Candidate> duplicateHeavyList() {
        return List.of(
                candidate("a.md", "0", "alpha beta gamma", 1.0),
                candidate("b.md", "0", "alpha beta gamma", 0.95),
                candidate("c.md", "0", "delta epsilon zeta", 0.9));
    }

    @Test
    void nearDuplicateIsDemotedBelowDistinctCandidate() {
        List<Candidate> result = diversifier.diversify(duplicateHeavyList(), MmrSettings.DEFAULT, 3);

        assertThat(result).extracting(Candidate::getSourcePath).containsExactly("a.md", "c.md", "b.md");
        assertEquals(0.85, result.get(0).score(ScoreComponent.DIVERSIFIED), 1e-9);
    }

    @Test
    void sameFileCandidatesArePenalized() {
        List<Candidate> input = List.of(
                candidate("x.md", "0", "one", 1.0),
                candidate("x.md", "1", "two", 0.99),
                candidate("y.md", "0", "three", 0.95));

        List<Candidate> result = diversifier.diversify(input, new MmrSettings(1.0, 0.1), 3);

        assertThat(result).extracting(Candidate::key).containsExactly("x.md#0", "y.md#0", "x.md#1");
    }

    @Test
    void outputIsDeterministicAcrossRuns() {
        List<Candidate> first = diversifier.diversify(duplicateHeavyList(), MmrSettings.DEFAULT, 3);
        List<Candidate> second = diversifier.diversify(duplicateHeavyList(), MmrSettings.DEFAULT, 3);

        assertEquals(first, second);
    }

    @Test
    void rerunningOnDiversifiedOutputKeepsRelevanceFromFusedScore() {
        List<Candidate> input = duplicateHeavyList();
        List<Candidate> once = diversifier.diversify(input, MmrSettings.DEFAULT, 3);
        List<Candidate> twice = diversifier.diversify(input, MmrSettings.DEFAULT, 3);

        assertEquals(once, twice);
    }

    @Test
    void equalObjectivesKeepInputOrder() {
        List<Candidate> input = List.of(
                candidate("p.md", "0", "red", 0.5),
                candidate("q.md", "0", "green", 0.5),
                candidate("r.md", "0", "blue", 0.5));

        List<Candidate> result = diversifier.diversify(input, MmrSettings.DEFAULT, 3);

        assertEquals(input, result);
    }

    @Test
    void resultIsBoundedByKAndInputSize() {
        assertEquals(2, diversifier.diversify(duplicateHeavyList(), MmrSettings.DEFAULT, 2).size());
        assertEquals(3, diversifier.diversify(duplicateHeavyList(), MmrSettings.DEFAULT, 10).size());
        assertTrue(diversifier.diversify(duplicateHeavyList(), MmrSettings.DEFAULT, 0).isEmpty());
        assertTrue(diversifier.diversify(List.of(), MmrSettings.DEFAULT, 5).isEmpty());
    }

    @Test
    void rerankedScoreOutranksFusedScore() {
        Candidate fusedFavourite = candidate("p.md", "0", "red green", 1.0);
        fusedFavourite.putScore(ScoreComponent.RERANKED, 0.2);
        Candidate rerankFavourite = candidate("q.md", "0", "blue yellow", 0.5);
        rerankFavourite.putScore(ScoreComponent.RERANKED, 0.9);

        List<Candidate> result = diversifier.diversify(List.of(fusedFavourite, rerankFavourite), MmrSettings.DEFAULT, 2);

        assertThat(result).extracting(Candidate::getSourcePath).containsExactly("q.md", "p.md");
        assertEquals(0.85, result.get(0).score(ScoreComponent.DIVERSIFIED), 1e-9);
    }

    @Test
    void negativeKIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> diversifier.diversify(duplicateHeavyList(), MmrSettings.DEFAULT, -1));
    }

    @Test
    void settingsAreValidated() {
        assertThrows(IllegalArgumentException.class, () -> new MmrSettings(1.5, 0.1));
        assertThrows(IllegalArgumentException.class, () -> new MmrSettings(0.5, -0.1));
    }
}
