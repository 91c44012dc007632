package com.jreinhal.quarry.util;

import com.jreinhal.quarry.constant.StopWords;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextTokensTest {

    @Test
    void keepsIdentifierCharactersAndTrimsEdgePunctuation() {
        assertEquals(List.of("see", "docs", "guide.md", "and", "cache_prefix", "v1.2"), TextTokens.tokenList("See docs/guide.md, and CACHE_PREFIX (v1.2)."));
    }

    @Test
    void dashesAtEdgesAreTrimmed() {
        assertEquals(List.of("rollout", "blue-green"), TextTokens.tokenList("-- rollout: blue-green -"));
    }

    @Test
    void stopWordsAreRemoved() {
        assertEquals(Set.of("cache", "prefix"), TextTokens.tokens("what is the cache prefix", StopWords.READER));
    }

    @Test
    void whitespaceCollapseHandlesUnicodeSpaces() {
        assertEquals("a b c", TextTokens.collapseWhitespace(" a \t b \nc  "));
        assertEquals("", TextTokens.collapseWhitespace(null));
    }

    @Test
    void jaccardOverlap() {
        assertEquals(1.0 / 3.0, TextTokens.jaccard(Set.of("a", "b"), Set.of("b", "c")), 1e-9);
        assertEquals(0.0, TextTokens.jaccard(Set.of(), Set.of("a")), 1e-9);
        assertTrue(TextTokens.tokenList(null).isEmpty());
    }
}
