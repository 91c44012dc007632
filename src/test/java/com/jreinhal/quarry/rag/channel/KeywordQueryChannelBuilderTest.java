package com.jreinhal.quarry.rag.channel;

import com.jreinhal.quarry.QueryTag;
import com.jreinhal.quarry.model.ChannelQuerySet;
import com.jreinhal.quarry.model.DenseQuery;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeywordQueryChannelBuilderTest {
    private KeywordQueryChannelBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new KeywordQueryChannelBuilder();
        ReflectionTestUtils.setField(builder, "vectorEnabled", false);
    }

    @Test
    void blankQuestionYieldsEmptySet() {
        assertTrue(builder.build("   ", QueryTag.GENERAL).isEmpty());
        assertTrue(builder.build(null, QueryTag.GENERAL).isEmpty());
    }

    @Test
    void lexicalChannelIsTheCleanedQuestion() {
        ChannelQuerySet set = builder.build("  where   is\tthe\u0000config?  ", QueryTag.GENERAL);

        assertEquals("where is the config?", set.lexicalQuery());
        assertFalse(set.isEmpty());
    }

    @Test
    void keywordChannelsDropStopWordsAndAddTagHints() {
        ChannelQuerySet set = builder.build("How do I create the index for 001_setup.md?", QueryTag.DB_WORKFLOWS);

        assertEquals("create index 001_setup.md alter table", set.shortQuery());
        assertEquals("001_setup.md create index", set.titleQuery());
        assertEquals(Optional.of("001_setup"), set.docHint());
        assertThat(set.phraseHints()).contains("create index", "using hnsw");
    }

    @Test
    void stopWordOnlyQuestionFallsBackToLexical() {
        ChannelQuerySet set = builder.build("what is the", QueryTag.GENERAL);

        assertEquals("what is the", set.shortQuery());
        assertEquals("what is the", set.titleQuery());
        assertEquals("what is the", set.lexicalQuery());
    }

    @Test
    void quotedPhrasesBecomeHints() {
        ChannelQuerySet set = builder.build("Which file mentions \"Rolling Restart\" steps?", QueryTag.GENERAL);

        assertThat(set.phraseHints()).containsExactly("rolling restart");
    }

    @Test
    void identicalInputsGiveIdenticalSets() {
        String question = "Which env var sets the cache prefix?";

        assertEquals(builder.build(question, QueryTag.OPS_HEALTH), builder.build(question, QueryTag.OPS_HEALTH));
    }

    @Test
    void vectorChannelOmittedWhenDisabled() {
        ChannelQuerySet set = builder.build("rollback procedure", QueryTag.META_OPS);

        assertTrue(set.dense().isEmpty());
    }

    @Test
    void vectorChannelCarriesKeywordText() {
        ReflectionTestUtils.setField(builder, "vectorEnabled", true);

        DenseQuery dense = builder.build("the rollback procedure", QueryTag.GENERAL).dense().orElseThrow();

        assertEquals("rollback procedure", dense.text());
    }

    @Test
    void vectorChannelUsesLexicalTextWhenNoKeywordRemains() {
        ReflectionTestUtils.setField(builder, "vectorEnabled", true);

        DenseQuery dense = builder.build("what is the", QueryTag.GENERAL).dense().orElseThrow();

        assertEquals("what is the", dense.text());
    }
}
