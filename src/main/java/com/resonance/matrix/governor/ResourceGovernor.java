package com.resonance.matrix.governor;

import com.resonance.matrix.error.ResourceLimitExceededException;
import com.resonance.matrix.metrics.MetricsService;
import com.resonance.matrix.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;

/**
 * Samples memory and, when available, CPU temperature and decides whether a
 * long-running operation may continue.
 *
 * <p>Thresholds:</p>
 * <ul>
 *   <li>heap &gt;= {@code hardKillMb} or temperature &gt;= {@code hardKillCelsius}: HARD_KILL</li>
 *   <li>heap &gt;= {@code throttleMb} or temperature &gt;= {@code throttleCelsius}: THROTTLE</li>
 *   <li>otherwise: PROCEED</li>
 * </ul>
 *
 * <p>Callers sample at their own cadence; the migration engine does so before every
 * batch and at every heartbeat.</p>
 */
public class ResourceGovernor {
    private static final Logger log = LoggerFactory.getLogger(ResourceGovernor.class);

    private final GovernorConfig config;
    private final HardwareMonitor monitor;
    private final Sleeper sleeper;
    private final MetricsService metrics;

    private long peakMemoryMb;
    private long throttleCount;
    private boolean throttled;

    public ResourceGovernor(GovernorConfig config) {
        this(config, new JvmHardwareMonitor(), Sleeper.SYSTEM, new NoOpMetricsService());
    }

    public ResourceGovernor(GovernorConfig config, HardwareMonitor monitor, Sleeper sleeper,
                            MetricsService metrics) {
        this.config = config;
        this.monitor = monitor;
        this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    /**
     * Samples the monitor and classifies the current resource state.
     */
    public ResourceReading assess() {
        MemorySample memory = monitor.memory();
        OptionalDouble temp = monitor.cpuTemperature();
        Double celsius = temp.isPresent() ? temp.getAsDouble() : null;

        if (memory.usedMb() > peakMemoryMb) {
            peakMemoryMb = memory.usedMb();
        }
        metrics.recordMemoryUsage(memory.usedMb());

        if (memory.usedMb() >= config.hardKillMb()) {
            return new ResourceReading(ResourceDecision.HARD_KILL, memory, celsius,
                    "heap " + memory.usedMb() + "MB >= " + config.hardKillMb() + "MB");
        }
        if (celsius != null && celsius >= config.hardKillCelsius()) {
            return new ResourceReading(ResourceDecision.HARD_KILL, memory, celsius,
                    "cpu " + celsius + "C >= " + config.hardKillCelsius() + "C");
        }
        if (memory.usedMb() >= config.throttleMb()) {
            return new ResourceReading(ResourceDecision.THROTTLE, memory, celsius,
                    "heap " + memory.usedMb() + "MB >= " + config.throttleMb() + "MB");
        }
        if (celsius != null && celsius >= config.throttleCelsius()) {
            return new ResourceReading(ResourceDecision.THROTTLE, memory, celsius,
                    "cpu " + celsius + "C >= " + config.throttleCelsius() + "C");
        }
        return new ResourceReading(ResourceDecision.PROCEED, memory, celsius, "within limits");
    }

    /**
     * Assesses resources and acts on the verdict: sleeps for the throttle delay when
     * throttled, throws when the hard-kill threshold is crossed.
     *
     * @return the reading that was acted upon
     * @throws ResourceLimitExceededException on HARD_KILL
     */
    public ResourceReading enforce() {
        ResourceReading reading = assess();
        switch (reading.decision()) {
            case HARD_KILL -> {
                log.error("governor.hard_kill reason={} heapMB={}", reading.reason(), reading.memory().usedMb());
                throw new ResourceLimitExceededException(reading);
            }
            case THROTTLE -> {
                if (!throttled) {
                    log.warn("governor.throttle.on reason={}", reading.reason());
                }
                throttled = true;
                throttleCount++;
                pause();
            }
            case PROCEED -> {
                if (throttled) {
                    log.info("governor.throttle.off heapMB={}", reading.memory().usedMb());
                }
                throttled = false;
            }
        }
        return reading;
    }

    private void pause() {
        if (config.throttleDelay().isZero()) {
            return;
        }
        try {
            sleeper.sleep(config.throttleDelay());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("governor.throttle.interrupted");
        }
    }

    public long getPeakMemoryMb() {
        return peakMemoryMb;
    }

    public long getThrottleCount() {
        return throttleCount;
    }

    public boolean isThrottled() {
        return throttled;
    }

    public GovernorConfig getConfig() {
        return config;
    }
}
