package com.resonance.matrix.migration;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a single migration run.
 *
 * <pre>
 * IDLE -&gt; LOADING -&gt; PROCESSING &lt;-&gt; CHECKPOINTING -&gt; COMPLETED | ABORTED
 * </pre>
 */
public enum MigrationState {
    IDLE,
    LOADING,
    PROCESSING,
    CHECKPOINTING,
    COMPLETED,
    ABORTED;

    /**
     * Returns the target state if the transition is legal.
     *
     * @throws IllegalStateException on an illegal transition
     */
    public MigrationState transitionTo(MigrationState next) {
        if (!successors().contains(next)) {
            throw new IllegalStateException("Illegal migration transition " + this + " -> " + next);
        }
        return next;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED;
    }

    private Set<MigrationState> successors() {
        return switch (this) {
            case IDLE -> EnumSet.of(LOADING);
            case LOADING -> EnumSet.of(PROCESSING, COMPLETED, ABORTED);
            case PROCESSING -> EnumSet.of(CHECKPOINTING, COMPLETED, ABORTED);
            case CHECKPOINTING -> EnumSet.of(PROCESSING, COMPLETED, ABORTED);
            case COMPLETED, ABORTED -> EnumSet.noneOf(MigrationState.class);
        };
    }
}
