package com.resonance.matrix.governor;

import java.time.Duration;

/**
 * Thresholds enforced by the {@link ResourceGovernor} and timeouts of the {@link FailSafeExecutor}.
 *
 * @param memoryTargetMb   expected steady-state heap, reported only
 * @param throttleMb       heap at which batches are slowed down
 * @param hardKillMb       heap at which processing stops
 * @param throttleCelsius  temperature at which batches are slowed down
 * @param hardKillCelsius  temperature at which processing stops
 * @param throttleDelay    pause inserted before a batch while throttled
 * @param failoverTimeout  time the primary implementation gets before failing over
 */
public record GovernorConfig(
        long memoryTargetMb,
        long throttleMb,
        long hardKillMb,
        double throttleCelsius,
        double hardKillCelsius,
        Duration throttleDelay,
        Duration failoverTimeout
) {
    public GovernorConfig {
        if (memoryTargetMb <= 0 || throttleMb <= 0 || hardKillMb <= 0) {
            throw new IllegalArgumentException("Memory thresholds must be > 0");
        }
        if (throttleMb > hardKillMb) {
            throw new IllegalArgumentException("throttleMb must not exceed hardKillMb");
        }
        if (throttleCelsius > hardKillCelsius) {
            throw new IllegalArgumentException("throttleCelsius must not exceed hardKillCelsius");
        }
        if (throttleDelay == null || throttleDelay.isNegative()) {
            throw new IllegalArgumentException("throttleDelay must be >= 0");
        }
        if (failoverTimeout == null || failoverTimeout.isNegative() || failoverTimeout.isZero()) {
            throw new IllegalArgumentException("failoverTimeout must be positive");
        }
    }

    /**
     * Defaults: 256MB target, throttle at 768MB, kill at 1024MB, throttle at 80C, kill at 95C,
     * 100ms throttle delay, 10ms failover timeout.
     */
    public static GovernorConfig defaults() {
        return new GovernorConfig(256, 768, 1024, 80.0, 95.0, Duration.ofMillis(100), Duration.ofMillis(10));
    }
}
