package com.resonance.matrix.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code matrix.signals.applied} / {@code matrix.signals.dropped}: Counters</li>
 *   <li>{@code matrix.migration.batch.duration}: Timer</li>
 *   <li>{@code matrix.migration.batch.size}: DistributionSummary</li>
 *   <li>{@code matrix.migration.nodes.skipped}: Counter</li>
 *   <li>{@code matrix.migration.checkpoints}: Counter</li>
 *   <li>{@code matrix.governor.memory}: Gauge of the last sampled heap in MB</li>
 *   <li>{@code matrix.failover}: Counter (tag: operation)</li>
 *   <li>{@code matrix.route.discovery.duration}: Timer (tag: withinBudget)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Counter signalsApplied;
    private final Counter signalsDropped;
    private final Timer batchTimer;
    private final DistributionSummary batchSize;
    private final Counter nodesSkipped;
    private final Counter checkpoints;
    private final AtomicLong memoryMb = new AtomicLong();
    private final Map<String, Counter> failoverCounters = new ConcurrentHashMap<>();
    private final Map<Boolean, Timer> routeTimers = new ConcurrentHashMap<>();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.signalsApplied = Counter.builder("matrix.signals.applied")
                .description("Signals resolved to a node and applied")
                .register(registry);
        this.signalsDropped = Counter.builder("matrix.signals.dropped")
                .description("Signals that matched no node")
                .register(registry);
        this.batchTimer = Timer.builder("matrix.migration.batch.duration")
                .description("Duration of one migration batch")
                .register(registry);
        this.batchSize = DistributionSummary.builder("matrix.migration.batch.size")
                .description("Nodes consumed per migration batch")
                .register(registry);
        this.nodesSkipped = Counter.builder("matrix.migration.nodes.skipped")
                .description("Nodes rejected by validation")
                .register(registry);
        this.checkpoints = Counter.builder("matrix.migration.checkpoints")
                .description("Checkpoints written")
                .register(registry);
        registry.gauge("matrix.governor.memory", memoryMb);
    }

    @Override
    public void incrementSignalsApplied(int count) {
        signalsApplied.increment(count);
    }

    @Override
    public void incrementSignalsDropped(int count) {
        signalsDropped.increment(count);
    }

    @Override
    public void recordBatch(int size, Duration duration) {
        batchTimer.record(duration);
        batchSize.record(size);
    }

    @Override
    public void incrementNodesSkipped() {
        nodesSkipped.increment();
    }

    @Override
    public void incrementCheckpoints() {
        checkpoints.increment();
    }

    @Override
    public void recordMemoryUsage(long usedMb) {
        memoryMb.set(usedMb);
    }

    @Override
    public void incrementFailover(String operation) {
        Counter counter = failoverCounters.computeIfAbsent(operation, op ->
                Counter.builder("matrix.failover")
                        .description("Operations that fell back to the legacy implementation")
                        .tag("operation", op)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordRouteDiscovery(Duration duration, boolean withinBudget) {
        Timer timer = routeTimers.computeIfAbsent(withinBudget, within ->
                Timer.builder("matrix.route.discovery.duration")
                        .description("Duration of self-heal passes")
                        .tag("withinBudget", String.valueOf(within))
                        .register(registry));
        timer.record(duration);
    }
}
