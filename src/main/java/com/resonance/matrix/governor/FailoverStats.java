package com.resonance.matrix.governor;

import java.time.Instant;

/**
 * Snapshot of failover activity.
 *
 * @param failoverCount number of operations that fell back to legacy
 * @param lastFailover  time of the most recent failover, null if none
 */
public record FailoverStats(long failoverCount, Instant lastFailover) {
}
