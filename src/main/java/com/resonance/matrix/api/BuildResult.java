package com.resonance.matrix.api;

import com.resonance.matrix.core.model.LinkRecommendation;
import com.resonance.matrix.core.model.Node;
import com.resonance.matrix.core.model.NodeProposal;
import com.resonance.matrix.scoring.ScoringReport;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of a registry build.
 *
 * @param nodes           the scored registry
 * @param recommendations link recommendations in cluster order
 * @param proposals       expansion proposals for high-resonance nodes
 * @param scoring         summary of the scoring pass
 * @param written         false for a dry run
 * @param outputDir       where the artifacts were (or would have been) written
 */
public record BuildResult(
        List<Node> nodes,
        List<LinkRecommendation> recommendations,
        List<NodeProposal> proposals,
        ScoringReport scoring,
        boolean written,
        Path outputDir
) {
    public BuildResult {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
        proposals = proposals != null ? List.copyOf(proposals) : List.of();
    }

    @Override
    public String toString() {
        return "BuildResult{nodes=" + nodes.size() +
                ", recommendations=" + recommendations.size() +
                ", proposals=" + proposals.size() +
                ", signalsApplied=" + scoring.signalsApplied() +
                ", written=" + written + '}';
    }
}
