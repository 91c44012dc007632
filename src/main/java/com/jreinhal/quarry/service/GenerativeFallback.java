package com.jreinhal.quarry.service;

import java.util.Optional;

/**
 * Generative answer source consulted only when no deterministic extraction rule fires.
 */
public interface GenerativeFallback {
    /**
     * @return the free-text answer, or empty when the model is unavailable, failed or timed out
     */
    Optional<String> generate(String context, String question);
}
