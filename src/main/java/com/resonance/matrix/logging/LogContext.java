package com.resonance.matrix.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forMigration(runId, inputFile)) {
 *     log.info("migration.checkpoint index={}", index);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Log context for a registry build.
     */
    public static LogContext forBuild(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "build");
        return ctx;
    }

    /**
     * Log context for a streaming migration run.
     */
    public static LogContext forMigration(String runId, String input) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("input", input);
        ctx.put("operation", "migrate");
        return ctx;
    }

    /**
     * Log context for a self-heal pass.
     */
    public static LogContext forSelfHeal(String runId, int failedNodes) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("failedNodes", String.valueOf(failedNodes));
        ctx.put("operation", "self-heal");
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
