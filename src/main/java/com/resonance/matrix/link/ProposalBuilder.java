package com.resonance.matrix.link;

import com.resonance.matrix.core.model.Node;
import com.resonance.matrix.core.model.NodeProposal;

import java.util.List;

/**
 * Flags nodes whose resonance reaches the proposal threshold for manual review.
 */
public class ProposalBuilder {

    private final double threshold;

    public ProposalBuilder(LinkConfig config) {
        this.threshold = config.proposalThreshold();
    }

    public List<NodeProposal> build(List<Node> nodes) {
        return nodes.stream()
                .filter(node -> node.getResonanceScore() >= threshold)
                .map(NodeProposal::draftFor)
                .toList();
    }
}
