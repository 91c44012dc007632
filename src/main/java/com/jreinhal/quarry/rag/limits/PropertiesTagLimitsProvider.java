package com.jreinhal.quarry.rag.limits;

import com.jreinhal.quarry.QueryTag;
import com.jreinhal.quarry.config.TagLimitsProperties;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class PropertiesTagLimitsProvider implements TagLimitsProvider {
    private static final Logger log = LoggerFactory.getLogger(PropertiesTagLimitsProvider.class);
    private final TagLimitsProperties properties;

    public PropertiesTagLimitsProvider(TagLimitsProperties properties) {
        this.properties = properties;
    }

    @Override
    public TagLimits limitsFor(QueryTag tag) {
        int shortlist = Math.max(1, this.properties.getDefaultShortlist());
        int topk = Math.max(1, this.properties.getDefaultTopk());
        TagLimitsProperties.Entry entry = tag != null ? this.findEntry(tag) : null;
        if (entry == null) {
            if (log.isDebugEnabled()) {
                log.debug("No limits configured for tag {}; using defaults shortlist={}, topk={}", new Object[]{tag, shortlist, topk});
            }
            return new TagLimits(shortlist, topk);
        }
        if (entry.getShortlist() != null && entry.getShortlist() > 0) {
            shortlist = entry.getShortlist();
        }
        if (entry.getTopk() != null && entry.getTopk() > 0) {
            topk = entry.getTopk();
        }
        return new TagLimits(shortlist, topk);
    }

    private TagLimitsProperties.Entry findEntry(QueryTag tag) {
        for (Map.Entry<String, TagLimitsProperties.Entry> e : this.properties.getTags().entrySet()) {
            String key = e.getKey() != null ? e.getKey().trim().toLowerCase(Locale.ROOT) : "";
            if (key.equals(tag.getLabel()) || key.equals(tag.name().toLowerCase(Locale.ROOT))) {
                return e.getValue();
            }
        }
        return null;
    }
}
