package com.resonance.matrix.migration;

/**
 * Callback interface for tracking progress of a migration run.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called after every batch.
     */
    void onBatch(BatchProgress progress);

    /**
     * A no-op progress callback.
     */
    ProgressCallback NOOP = progress -> {};
}
