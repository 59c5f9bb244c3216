package com.resonance.matrix.scoring;

/**
 * Summary of one scoring pass.
 *
 * @param signalsApplied    signals resolved to a node
 * @param signalsDropped    signals that matched no node
 * @param decayedUnobserved nodes that received the step decay
 * @param decayedByAge      nodes that decayed according to the age of their last signal
 */
public record ScoringReport(int signalsApplied, int signalsDropped, int decayedUnobserved, int decayedByAge) {
}
