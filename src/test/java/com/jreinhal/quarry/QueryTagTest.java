package com.jreinhal.quarry;

import java.util.Locale;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryTagTest {

    @Test
    void resolvesLabelsAndEnumNames() {
        assertEquals(QueryTag.DB_WORKFLOWS, QueryTag.fromLabel("db_workflows"));
        assertEquals(QueryTag.DB_WORKFLOWS, QueryTag.fromLabel(" DB_WORKFLOWS "));
        assertEquals(QueryTag.RAG_QA_SINGLE, QueryTag.fromLabel("Rag_Qa_Single"));
    }

    @Test
    void rejectsBlankAndUnknownLabels() {
        assertThrows(IllegalArgumentException.class, () -> QueryTag.fromLabel(""));
        assertThrows(IllegalArgumentException.class, () -> QueryTag.fromLabel(null));
        assertThrows(IllegalArgumentException.class, () -> QueryTag.fromLabel("finance"));
    }

    @Test
    void onlyDatabaseTagIsDatabaseWorkflow() {
        assertTrue(QueryTag.DB_WORKFLOWS.isDatabaseWorkflow());
        for (QueryTag tag : QueryTag.values()) {
            if (tag == QueryTag.DB_WORKFLOWS) continue;
            assertFalse(tag.isDatabaseWorkflow());
        }
    }

    @Test
    void bonusTokensAreLowercase() {
        for (QueryTag tag : QueryTag.values()) {
            for (String token : tag.getBonusTokens()) {
                assertEquals(token.toLowerCase(Locale.ROOT), token);
            }
        }
        assertTrue(QueryTag.OPS_HEALTH.getBonusTokens().contains("env"));
        assertTrue(QueryTag.GENERAL.getBonusTokens().isEmpty());
    }
}
