package com.resonance.matrix.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Proposed outbound links from one node to the high-resonance hubs of its cluster.
 *
 * @param from    the source node id
 * @param to      ordered hub ids; never contains {@code from}
 * @param cluster the shared cluster
 * @param reason  why the links are proposed
 * @param status  review state
 */
public record LinkRecommendation(
        String from,
        List<String> to,
        String cluster,
        String reason,
        RecommendationStatus status
) {

    public LinkRecommendation {
        Objects.requireNonNull(from, "from is required");
        to = to != null ? List.copyOf(to) : List.of();
        if (to.contains(from)) {
            throw new IllegalArgumentException("Recommendation from '" + from + "' must not target itself");
        }
        status = status != null ? status : RecommendationStatus.DRAFT;
    }
}
