package com.resonance.matrix.governor;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.util.OptionalDouble;

/**
 * Reads heap usage from the JVM. No temperature sensor is exposed.
 */
public class JvmHardwareMonitor implements HardwareMonitor {

    private static final long MB = 1024 * 1024;

    private final MemoryMXBean memoryBean;

    public JvmHardwareMonitor() {
        this(ManagementFactory.getMemoryMXBean());
    }

    JvmHardwareMonitor(MemoryMXBean memoryBean) {
        this.memoryBean = memoryBean;
    }

    @Override
    public MemorySample memory() {
        MemoryUsage heap = memoryBean.getHeapMemoryUsage();
        long max = heap.getMax();
        return new MemorySample(heap.getUsed() / MB, max > 0 ? max / MB : -1);
    }

    @Override
    public OptionalDouble cpuTemperature() {
        return OptionalDouble.empty();
    }
}
