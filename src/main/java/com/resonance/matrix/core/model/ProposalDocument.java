package com.resonance.matrix.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Contents of {@code node-proposals.json}.
 */
public record ProposalDocument(String version, Instant generated, RecommendationStatus status,
                               List<NodeProposal> proposals) {

    public ProposalDocument {
        proposals = proposals != null ? List.copyOf(proposals) : List.of();
        status = status != null ? status : RecommendationStatus.DRAFT;
    }
}
