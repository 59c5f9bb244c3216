package com.resonance.matrix.link;

/**
 * Configuration for link recommendation and proposal selection.
 *
 * @param topK              number of hubs selected per cluster
 * @param proposalThreshold minimum resonance for a node to be proposed for expansion
 */
public record LinkConfig(int topK, double proposalThreshold) {

    public LinkConfig {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be > 0");
        }
        if (proposalThreshold < 0) {
            throw new IllegalArgumentException("proposalThreshold must be >= 0");
        }
    }

    /**
     * Default configuration: 5 hubs per cluster, proposals at resonance 2.5.
     */
    public static LinkConfig defaults() {
        return new LinkConfig(5, 2.5);
    }
}
