package com.resonance.matrix.health;

import com.resonance.matrix.governor.ResourceGovernor;
import com.resonance.matrix.governor.ResourceReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports the resource governor's current verdict as a health status:
 * DOWN past the hard-kill threshold, DEGRADED while throttling, UP otherwise.
 */
public class ResourceHealthCheck {
    private static final Logger log = LoggerFactory.getLogger(ResourceHealthCheck.class);

    private final ResourceGovernor governor;

    public ResourceHealthCheck(ResourceGovernor governor) {
        this.governor = governor;
    }

    public HealthStatus check() {
        ResourceReading reading = governor.assess();
        HealthStatus.Status level = HealthStatus.Status.of(reading.decision());
        HealthStatus status = new HealthStatus(
                level,
                level == HealthStatus.Status.UP ? "OK" : reading.reason(),
                reading.memory().usedMb(),
                reading.memory().maxMb(),
                governor.getPeakMemoryMb(),
                reading.temperatureCelsius());
        if (!status.isUp()) {
            log.warn("health.resources status={} reason={}", level, status.reason());
        }
        return status;
    }
}
