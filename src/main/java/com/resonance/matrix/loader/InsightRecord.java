package com.resonance.matrix.loader;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * An insight as stored in {@code insights.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InsightRecord(String slug, String title) {

    /**
     * The slug, or the normalized title when no slug is present.
     */
    public String key() {
        return !Keys.isBlank(slug) ? slug : Keys.normalizeKey(title);
    }
}
