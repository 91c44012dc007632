package com.jreinhal.quarry.config;

import java.util.HashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "quarry.limits")
public class TagLimitsProperties {
    /**
     * Shortlist size for tags without an entry.
     */
    private int defaultShortlist = 24;

    /**
     * Reader candidate ceiling for tags without an entry.
     */
    private int defaultTopk = 8;

    /**
     * Per-tag overrides keyed by tag label.
     *
     * Example:
     * quarry.limits.tags.db_workflows.shortlist=40
     * quarry.limits.tags.db_workflows.topk=10
     */
    private Map<String, Entry> tags = new HashMap<>();

    public int getDefaultShortlist() {
        return defaultShortlist;
    }

    public void setDefaultShortlist(int defaultShortlist) {
        this.defaultShortlist = defaultShortlist;
    }

    public int getDefaultTopk() {
        return defaultTopk;
    }

    public void setDefaultTopk(int defaultTopk) {
        this.defaultTopk = defaultTopk;
    }

    public Map<String, Entry> getTags() {
        return tags;
    }

    public void setTags(Map<String, Entry> tags) {
        this.tags = tags != null ? tags : new HashMap<>();
    }

    public static class Entry {
        private Integer shortlist;
        private Integer topk;

        public Integer getShortlist() {
            return shortlist;
        }

        public void setShortlist(Integer shortlist) {
            this.shortlist = shortlist;
        }

        public Integer getTopk() {
            return topk;
        }

        public void setTopk(Integer topk) {
            this.topk = topk;
        }
    }
}
