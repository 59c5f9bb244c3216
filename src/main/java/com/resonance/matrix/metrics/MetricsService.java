package com.resonance.matrix.metrics;

import java.time.Duration;

/**
 * Interface for recording pipeline metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a meter registry.
 */
public interface MetricsService {

    void incrementSignalsApplied(int count);

    void incrementSignalsDropped(int count);

    void recordBatch(int size, Duration duration);

    void incrementNodesSkipped();

    void incrementCheckpoints();

    void recordMemoryUsage(long usedMb);

    void incrementFailover(String operation);

    void recordRouteDiscovery(Duration duration, boolean withinBudget);
}
