package com.jreinhal.quarry.rag.limits;

import com.jreinhal.quarry.QueryTag;
import com.jreinhal.quarry.config.TagLimitsProperties;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PropertiesTagLimitsProviderTest {
    private TagLimitsProperties properties;
    private PropertiesTagLimitsProvider provider;

    private static TagLimitsProperties.Entry entry(Integer shortlist, Integer topk) {
        TagLimitsProperties.Entry entry = new TagLimitsProperties.Entry();
        entry.setShortlist(shortlist);
        entry.setTopk(topk);
        return entry;
    }

    @BeforeEach
    void setUp() {
        properties = new TagLimitsProperties();
        Map<String, TagLimitsProperties.Entry> tags = new HashMap<>();
        tags.put("db_workflows", entry(40, 10));
        tags.put("OPS_HEALTH", entry(30, null));
        properties.setTags(tags);
        provider = new PropertiesTagLimitsProvider(properties);
    }

    @Test
    void unconfiguredTagsGetDefaults() {
        assertEquals(TagLimits.DEFAULT, provider.limitsFor(QueryTag.GENERAL));
    }

    @Test
    void configuredTagOverridesBothLimits() {
        assertEquals(new TagLimits(40, 10), provider.limitsFor(QueryTag.DB_WORKFLOWS));
    }

    @Test
    void partialEntryKeepsDefaultForMissingValue() {
        assertEquals(new TagLimits(30, 8), provider.limitsFor(QueryTag.OPS_HEALTH));
    }

    @Test
    void changedDefaultsApply() {
        properties.setDefaultShortlist(50);
        properties.setDefaultTopk(0);

        assertEquals(new TagLimits(50, 1), provider.limitsFor(QueryTag.NEGATIVES));
    }

    @Test
    void limitsMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new TagLimits(0, 5));
        assertThrows(IllegalArgumentException.class, () -> new TagLimits(5, 0));
    }
}
