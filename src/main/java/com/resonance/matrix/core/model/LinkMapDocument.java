package com.resonance.matrix.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Contents of {@code link-map.json}.
 */
public record LinkMapDocument(String version, Instant generated, List<LinkRecommendation> recommendations) {

    public LinkMapDocument {
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }
}
