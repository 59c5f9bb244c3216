package com.resonance.matrix.governor;

/**
 * Result of one governor assessment.
 *
 * @param decision           what the caller must do
 * @param memory             sampled heap usage
 * @param temperatureCelsius sampled CPU temperature, null when unavailable
 * @param reason             human readable explanation of the decision
 */
public record ResourceReading(
        ResourceDecision decision,
        MemorySample memory,
        Double temperatureCelsius,
        String reason
) {

    public boolean isHardKill() {
        return decision == ResourceDecision.HARD_KILL;
    }

    public boolean isThrottled() {
        return decision == ResourceDecision.THROTTLE;
    }
}
