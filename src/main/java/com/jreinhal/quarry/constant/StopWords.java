package com.jreinhal.quarry.constant;

import java.util.Set;

public final class StopWords {
    public static final Set<String> CHANNEL_KEYWORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to",
            "for", "of", "with", "by", "from", "as", "is", "was", "are",
            "were", "been", "be", "have", "has", "had", "what", "where",
            "when", "who", "how", "why", "which", "tell", "me", "about",
            "describe", "find", "show", "give", "also", "do", "does", "did",
            "this", "that", "these", "those", "it", "its", "we", "our", "i",
            "can", "should", "would", "could", "there", "their"
    );

    public static final Set<String> READER = Set.of(
            "the", "a", "an", "is", "are", "was", "were", "what", "where",
            "when", "who", "how", "why", "which", "and", "or", "but", "in",
            "on", "at", "to", "for", "of", "with", "do", "does", "did", "be",
            "it", "this", "that", "by", "as", "from"
    );

    private StopWords() {
    }
}
