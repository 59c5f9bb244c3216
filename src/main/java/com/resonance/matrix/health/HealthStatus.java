package com.resonance.matrix.health;

import com.resonance.matrix.governor.ResourceDecision;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of the resources the pipeline runs on.
 *
 * @param status      governor verdict translated to a health level
 * @param reason      why the level is not UP, "OK" otherwise
 * @param heapUsedMb  sampled heap usage
 * @param heapMaxMb   maximum heap, -1 when undefined
 * @param peakHeapMb  highest heap usage the governor has seen
 * @param cpuCelsius  sampled CPU temperature, null without a sensor
 */
public record HealthStatus(
        Status status,
        String reason,
        long heapUsedMb,
        long heapMaxMb,
        long peakHeapMb,
        Double cpuCelsius
) {

    public enum Status {
        UP, DEGRADED, DOWN;

        static Status of(ResourceDecision decision) {
            return switch (decision) {
                case HARD_KILL -> DOWN;
                case THROTTLE -> DEGRADED;
                case PROCEED -> UP;
            };
        }
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }

    /**
     * Flat view for status endpoints and log lines. The temperature is omitted when unknown.
     */
    public Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("heapUsedMB", heapUsedMb);
        details.put("heapMaxMB", heapMaxMb);
        details.put("peakHeapMB", peakHeapMb);
        if (cpuCelsius != null) {
            details.put("cpuCelsius", cpuCelsius);
        }
        return details;
    }
}
