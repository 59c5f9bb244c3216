package com.resonance.matrix.governor;

import com.resonance.matrix.error.FailoverException;
import com.resonance.matrix.metrics.MetricsService;
import com.resonance.matrix.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a new implementation of an operation under a timeout and falls back to the
 * legacy implementation when it times out or throws.
 *
 * <p>The primary runs on the supplied executor so that it can be abandoned on timeout;
 * the legacy runs on the calling thread. Failovers are counted and the time of the most
 * recent one is kept.</p>
 */
public class FailSafeExecutor {
    private static final Logger log = LoggerFactory.getLogger(FailSafeExecutor.class);

    private final ExecutorService executor;
    private final Duration timeout;
    private final Clock clock;
    private final MetricsService metrics;
    private final AtomicLong failoverCount = new AtomicLong();
    private final AtomicReference<Instant> lastFailover = new AtomicReference<>();

    public FailSafeExecutor(ExecutorService executor, Duration timeout) {
        this(executor, timeout, Clock.systemUTC(), new NoOpMetricsService());
    }

    public FailSafeExecutor(ExecutorService executor, Duration timeout, Clock clock, MetricsService metrics) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.executor = executor;
        this.timeout = timeout;
        this.clock = clock;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    /**
     * Executes {@code primary}, falling back to {@code legacy} on timeout or failure.
     *
     * @param operation name used in logs and metrics
     * @throws FailoverException when both implementations fail
     */
    public <T> ExecutionOutcome<T> execute(String operation, Callable<T> primary, Callable<T> legacy) {
        long start = System.nanoTime();
        Throwable primaryError;
        Future<T> future = executor.submit(primary);
        try {
            T result = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return new ExecutionOutcome<>(result, EngineKind.PRIMARY, Duration.ofNanos(System.nanoTime() - start),
                    false, null);
        } catch (TimeoutException e) {
            future.cancel(true);
            primaryError = new TimeoutException("exceeded " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            primaryError = e.getCause() != null ? e.getCause() : e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            primaryError = e;
        }

        failoverCount.incrementAndGet();
        lastFailover.set(clock.instant());
        metrics.incrementFailover(operation);
        log.warn("failover.triggered operation={} error={}", operation, primaryError.getMessage());

        long failoverStart = System.nanoTime();
        try {
            T result = legacy.call();
            return new ExecutionOutcome<>(result, EngineKind.LEGACY, Duration.ofNanos(System.nanoTime() - failoverStart),
                    true, primaryError.getMessage());
        } catch (Exception legacyError) {
            log.error("failover.failed operation={} primaryError={} legacyError={}",
                    operation, primaryError.getMessage(), legacyError.getMessage());
            throw new FailoverException(operation, primaryError, legacyError);
        }
    }

    public FailoverStats getStats() {
        return new FailoverStats(failoverCount.get(), lastFailover.get());
    }
}
