package com.resonance.matrix.governor;

import java.util.OptionalDouble;

/**
 * Source of resource measurements sampled by the {@link ResourceGovernor}.
 */
public interface HardwareMonitor {

    /**
     * Samples current memory usage.
     */
    MemorySample memory();

    /**
     * Samples the CPU temperature in degrees Celsius, empty when no sensor is available.
     */
    OptionalDouble cpuTemperature();
}
