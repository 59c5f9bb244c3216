package com.resonance.matrix.migration;

import java.util.List;
import java.util.Set;

/**
 * Configuration for the {@link StreamingMigrationEngine}.
 *
 * @param batchSize          nodes per batch yielded to the caller
 * @param heartbeatInterval  input indices between heartbeat records
 * @param checkpointInterval input indices between checkpoints and output flushes
 * @param anchors            gold-standard anchor names pinned during a run
 */
public record MigrationConfig(int batchSize, int heartbeatInterval, int checkpointInterval, Set<String> anchors) {

    public static final List<String> DEFAULT_ANCHORS = List.of(
            "fathers-sons", "mothers-daughters", "the-patriarch", "the-matriarch",
            "young-lions", "young-women", "the-professional", "the-griever",
            "the-addict", "the-protector", "men-solo", "women-solo");

    public MigrationConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (heartbeatInterval <= 0) {
            throw new IllegalArgumentException("heartbeatInterval must be > 0");
        }
        if (checkpointInterval <= 0) {
            throw new IllegalArgumentException("checkpointInterval must be > 0");
        }
        anchors = anchors != null ? Set.copyOf(anchors) : Set.of();
    }

    /**
     * Defaults: batches of 500, heartbeat every 1,000, checkpoint every 5,000, the standard anchors.
     */
    public static MigrationConfig defaults() {
        return new MigrationConfig(500, 1_000, 5_000, Set.copyOf(DEFAULT_ANCHORS));
    }

    public MigrationConfig withBatchSize(int size) {
        return new MigrationConfig(size, heartbeatInterval, checkpointInterval, anchors);
    }

    public MigrationConfig withIntervals(int heartbeat, int checkpoint) {
        return new MigrationConfig(batchSize, heartbeat, checkpoint, anchors);
    }
}
