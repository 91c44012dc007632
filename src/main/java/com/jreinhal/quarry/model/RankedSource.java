package com.jreinhal.quarry.model;

public record RankedSource(String sourceId, double score) {
}
