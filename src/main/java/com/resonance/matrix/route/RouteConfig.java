package com.resonance.matrix.route;

import java.time.Duration;

/**
 * Configuration for route discovery.
 *
 * @param maxDepth   maximum number of edges in a discovered route
 * @param maxRoutes  maximum number of routes returned per query
 * @param timeBudget target duration of a self-heal pass
 * @param cacheSize  maximum number of cached route queries
 */
public record RouteConfig(int maxDepth, int maxRoutes, Duration timeBudget, int cacheSize) {

    public RouteConfig {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be > 0");
        }
        if (maxRoutes <= 0) {
            throw new IllegalArgumentException("maxRoutes must be > 0");
        }
        if (timeBudget == null || timeBudget.isNegative() || timeBudget.isZero()) {
            throw new IllegalArgumentException("timeBudget must be positive");
        }
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be > 0");
        }
    }

    /**
     * Default configuration: depth 3, 5 routes, 50ms budget, 100,000 cached queries.
     */
    public static RouteConfig defaults() {
        return new RouteConfig(3, 5, Duration.ofMillis(50), 100_000);
    }
}
