package com.resonance.matrix.migration;

import com.resonance.matrix.core.model.MigratedNode;
import com.resonance.matrix.core.model.MigrationCheckpoint;

import java.time.Duration;
import java.util.List;

/**
 * Final summary of a migration invocation.
 *
 * @param state              terminal state of the run
 * @param inputSize          nodes in the input
 * @param processed          input indices consumed by this invocation
 * @param migrated           nodes transformed by this invocation
 * @param skipped            nodes rejected by this invocation
 * @param checkpointsWritten interval checkpoints written by this invocation
 * @param checkpoint         the last persisted (or, for a dry run, computed) checkpoint
 * @param abortReason        why the run stopped early, null otherwise
 * @param goldStandardNodes  anchors pinned during this invocation
 * @param elapsed            wall time of the invocation
 */
public record MigrationResult(
        MigrationState state,
        long inputSize,
        long processed,
        long migrated,
        long skipped,
        int checkpointsWritten,
        MigrationCheckpoint checkpoint,
        String abortReason,
        List<MigratedNode> goldStandardNodes,
        Duration elapsed
) {
    public MigrationResult {
        goldStandardNodes = goldStandardNodes != null ? List.copyOf(goldStandardNodes) : List.of();
    }

    /**
     * True when the whole input has been consumed, in this or earlier invocations.
     */
    public boolean isComplete() {
        return state == MigrationState.COMPLETED && checkpoint.completed();
    }

    /**
     * True when part of the input is still pending: the run was aborted or stopped at a limit.
     */
    public boolean isPartial() {
        return !isComplete();
    }

    public boolean isAborted() {
        return state == MigrationState.ABORTED;
    }

    @Override
    public String toString() {
        return "MigrationResult{state=" + state +
                ", processed=" + checkpoint.totalProcessed() + "/" + inputSize +
                ", migrated=" + migrated +
                ", skipped=" + skipped +
                ", checkpoints=" + checkpointsWritten +
                (abortReason != null ? ", abortReason=" + abortReason : "") + '}';
    }
}
