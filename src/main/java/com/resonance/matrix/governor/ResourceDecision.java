package com.resonance.matrix.governor;

/**
 * Verdict of a resource assessment, ordered by severity.
 */
public enum ResourceDecision {
    PROCEED,
    THROTTLE,
    HARD_KILL
}
