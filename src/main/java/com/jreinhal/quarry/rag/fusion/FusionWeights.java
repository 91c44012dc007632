package com.jreinhal.quarry.rag.fusion;

import java.util.EnumMap;
import java.util.Map;

/**
 * Channel weights for score fusion, before group rescaling.
 *
 * @param lambdaLex share of the fused score given to the lexical-group channels together
 * @param lambdaSem share given to the vector channel
 */
public record FusionWeights(double shortWeight, double titleWeight, double lexicalWeight, double vectorWeight, double lambdaLex, double lambdaSem) {
    public static final FusionWeights DEFAULT = new FusionWeights(0.20, 0.15, 0.35, 0.30, 0.6, 0.4);

    public double raw(RetrievalChannel channel) {
        return switch (channel) {
            case SHORT -> this.shortWeight;
            case TITLE -> this.titleWeight;
            case LEXICAL -> this.lexicalWeight;
            case VECTOR -> this.vectorWeight;
        };
    }

    /**
     * Rescales the weights so the lexical group sums to its lambda share and the vector channel to the other.
     * When the vector channel is not issued the lexical group takes the whole mass. A group whose weights are
     * all non-positive is split evenly.
     */
    public Map<RetrievalChannel, Double> scaled(boolean vectorIssued) {
        double lex = Math.max(0.0, this.lambdaLex);
        double sem = vectorIssued ? Math.max(0.0, this.lambdaSem) : 0.0;
        double total = lex + sem;
        if (total <= 0.0) {
            lex = vectorIssued ? 0.5 : 1.0;
            sem = vectorIssued ? 0.5 : 0.0;
        } else {
            lex /= total;
            sem /= total;
        }
        EnumMap<RetrievalChannel, Double> scaled = new EnumMap<RetrievalChannel, Double>(RetrievalChannel.class);
        this.scaleGroup(scaled, true, lex);
        if (vectorIssued) {
            this.scaleGroup(scaled, false, sem);
        } else {
            scaled.put(RetrievalChannel.VECTOR, 0.0);
        }
        return scaled;
    }

    private void scaleGroup(Map<RetrievalChannel, Double> out, boolean lexicalGroup, double share) {
        double sum = 0.0;
        int members = 0;
        for (RetrievalChannel channel : RetrievalChannel.values()) {
            if (channel.isLexicalGroup() != lexicalGroup) continue;
            sum += Math.max(0.0, this.raw(channel));
            ++members;
        }
        for (RetrievalChannel channel : RetrievalChannel.values()) {
            if (channel.isLexicalGroup() != lexicalGroup) continue;
            double weight = sum > 0.0 ? Math.max(0.0, this.raw(channel)) * share / sum : share / members;
            out.put(channel, weight);
        }
    }
}
