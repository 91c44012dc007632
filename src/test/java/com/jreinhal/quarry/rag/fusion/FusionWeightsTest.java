package com.jreinhal.quarry.rag.fusion;

import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FusionWeightsTest {

    @Test
    void weightsSplitBetweenGroupsByLambda() {
        Map<RetrievalChannel, Double> scaled = FusionWeights.DEFAULT.scaled(true);

        assertEquals(0.6 * 0.20 / 0.70, scaled.get(RetrievalChannel.SHORT), 1e-9);
        assertEquals(0.6 * 0.35 / 0.70, scaled.get(RetrievalChannel.LEXICAL), 1e-9);
        assertEquals(0.4, scaled.get(RetrievalChannel.VECTOR), 1e-9);
        assertEquals(1.0, scaled.values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
    }

    @Test
    void lexicalGroupTakesEverythingWithoutVector() {
        Map<RetrievalChannel, Double> scaled = FusionWeights.DEFAULT.scaled(false);

        assertEquals(0.0, scaled.get(RetrievalChannel.VECTOR), 1e-9);
        assertEquals(0.5, scaled.get(RetrievalChannel.LEXICAL), 1e-9);
        assertEquals(1.0, scaled.values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
    }

    @Test
    void zeroWeightGroupIsSplitEvenly() {
        FusionWeights weights = new FusionWeights(0.0, 0.0, 0.0, 0.3, 0.6, 0.4);

        Map<RetrievalChannel, Double> scaled = weights.scaled(true);

        assertEquals(0.2, scaled.get(RetrievalChannel.SHORT), 1e-9);
        assertEquals(0.2, scaled.get(RetrievalChannel.TITLE), 1e-9);
        assertEquals(0.2, scaled.get(RetrievalChannel.LEXICAL), 1e-9);
    }
}
