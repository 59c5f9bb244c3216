package com.resonance.matrix.core.model;

/**
 * A high-resonance node flagged for manual review as the seed of an adjacent intent.
 *
 * @param parentNodeId   the node that crossed the threshold
 * @param parentPath     its path
 * @param proposal       proposal kind
 * @param intentSeed     seed text for the adjacent intent, the node title
 * @param resonanceScore score at the time of the proposal
 * @param status         review state
 * @param requiresReview always true; proposals are never published automatically
 */
public record NodeProposal(
        String parentNodeId,
        String parentPath,
        String proposal,
        String intentSeed,
        double resonanceScore,
        RecommendationStatus status,
        boolean requiresReview
) {

    public static final String ADJACENT_INTENT_DRAFT = "adjacent-intent-draft";

    public static NodeProposal draftFor(Node node) {
        return new NodeProposal(node.getId(), node.getPath(), ADJACENT_INTENT_DRAFT,
                node.getTitle(), node.getResonanceScore(), RecommendationStatus.DRAFT, true);
    }
}
