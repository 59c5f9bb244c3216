package com.resonance.matrix.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Durable progress marker of a migration run.
 *
 * <p>{@code lastProcessedIndex} is the number of input indices consumed, so a resumed
 * run starts at exactly that index.</p>
 *
 * @param lastProcessedIndex      first input index not yet covered by flushed output
 * @param totalProcessed          input indices consumed, valid or skipped
 * @param migratedCount           nodes transformed and written
 * @param skippedCount            nodes rejected by validation
 * @param lastCheckpointTimestamp when this state was written
 * @param lastSuccessfulNodeId    id of the last transformed node, may be null
 * @param checkpointCount         number of output parts written; the next part is {@code checkpointCount + 1}
 * @param completed               true once the whole input was consumed
 * @param abortReason             why the run stopped early, null otherwise
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MigrationCheckpoint(
        long lastProcessedIndex,
        long totalProcessed,
        long migratedCount,
        long skippedCount,
        Instant lastCheckpointTimestamp,
        String lastSuccessfulNodeId,
        int checkpointCount,
        boolean completed,
        String abortReason
) {

    public static MigrationCheckpoint initial() {
        return new MigrationCheckpoint(0, 0, 0, 0, null, null, 0, false, null);
    }

    public MigrationCheckpoint withAbortReason(String reason) {
        return new MigrationCheckpoint(lastProcessedIndex, totalProcessed, migratedCount, skippedCount,
                lastCheckpointTimestamp, lastSuccessfulNodeId, checkpointCount, false, reason);
    }
}
