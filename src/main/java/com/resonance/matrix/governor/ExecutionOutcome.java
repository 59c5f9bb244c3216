package com.resonance.matrix.governor;

import java.time.Duration;

/**
 * Result of a {@link FailSafeExecutor} call.
 *
 * @param result        the value produced
 * @param engine        the implementation that produced it
 * @param duration      time spent in the implementation that produced it
 * @param failover      true when the legacy implementation was used
 * @param originalError message of the primary failure, null without failover
 */
public record ExecutionOutcome<T>(
        T result,
        EngineKind engine,
        Duration duration,
        boolean failover,
        String originalError
) {
}
