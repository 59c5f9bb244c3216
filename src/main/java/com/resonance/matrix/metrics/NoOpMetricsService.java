package com.resonance.matrix.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementSignalsApplied(int count) {
    }

    @Override
    public void incrementSignalsDropped(int count) {
    }

    @Override
    public void recordBatch(int size, Duration duration) {
    }

    @Override
    public void incrementNodesSkipped() {
    }

    @Override
    public void incrementCheckpoints() {
    }

    @Override
    public void recordMemoryUsage(long usedMb) {
    }

    @Override
    public void incrementFailover(String operation) {
    }

    @Override
    public void recordRouteDiscovery(Duration duration, boolean withinBudget) {
    }
}
