package com.resonance.matrix.migration;

/**
 * Per-invocation options of a migration run.
 *
 * @param dryRun validate and transform only; no checkpoint, log or output files are read or written
 * @param limit  maximum number of input indices consumed by this invocation, 0 for no limit
 * @param fresh  discard any persisted state and start from index 0
 */
public record MigrationOptions(boolean dryRun, long limit, boolean fresh) {

    public MigrationOptions {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
    }

    public static MigrationOptions defaults() {
        return new MigrationOptions(false, 0, false);
    }

    public boolean hasLimit() {
        return limit > 0;
    }
}
