package com.resonance.matrix.migration;

import java.time.Duration;

/**
 * Progress report yielded after every batch.
 *
 * @param batchNumber    1-based batch number within this invocation
 * @param nodesInBatch   input indices consumed by the batch
 * @param processedIndex input indices consumed so far, including resumed ones
 * @param inputSize      total nodes in the input
 * @param migratedCount  nodes transformed so far
 * @param skippedCount   nodes rejected so far
 * @param batchDuration  wall time of the batch
 * @param state          run state after the batch
 */
public record BatchProgress(
        int batchNumber,
        int nodesInBatch,
        long processedIndex,
        long inputSize,
        long migratedCount,
        long skippedCount,
        Duration batchDuration,
        MigrationState state
) {

    public double percentComplete() {
        if (inputSize == 0) {
            return 100.0;
        }
        return processedIndex * 100.0 / inputSize;
    }
}
