package com.resonance.matrix.governor;

/**
 * Which implementation produced an {@link ExecutionOutcome}.
 */
public enum EngineKind {
    PRIMARY,
    LEGACY
}
