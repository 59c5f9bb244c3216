package com.resonance.matrix.api;

import com.resonance.matrix.core.model.LinkRecommendation;
import com.resonance.matrix.governor.ExecutionOutcome;
import com.resonance.matrix.governor.FailSafeExecutor;
import com.resonance.matrix.route.RouteDiscoveryEngine;
import com.resonance.matrix.route.RouteResult;
import com.resonance.matrix.route.SelfHealReport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Route lookups that run the breadth-first engine first and fall back to the plain
 * link-map lookup when it is too slow or fails.
 *
 * <p>The fallback only returns direct neighbors of the target, never a deeper route.</p>
 */
public class ResilientRouter {

    private final RouteDiscoveryEngine engine;
    private final FailSafeExecutor executor;
    private final Map<String, List<String>> linkMap = new LinkedHashMap<>();
    private final int maxRoutes;

    ResilientRouter(RouteDiscoveryEngine engine, FailSafeExecutor executor,
                    List<LinkRecommendation> recommendations, int maxRoutes) {
        this.engine = engine;
        this.executor = executor;
        this.maxRoutes = maxRoutes;
        for (LinkRecommendation rec : recommendations) {
            List<String> targets = linkMap.computeIfAbsent(rec.from(), k -> new ArrayList<>());
            for (String to : rec.to()) {
                if (!targets.contains(to)) {
                    targets.add(to);
                }
            }
        }
    }

    public ExecutionOutcome<RouteResult> findRoutes(String failedNodeId, String targetNodeId) {
        return executor.execute("route.discovery",
                () -> engine.findAlternativeRoutes(failedNodeId, targetNodeId),
                () -> directNeighbors(failedNodeId, targetNodeId));
    }

    public SelfHealReport selfHeal(Collection<String> failedNodeIds) {
        return engine.selfHeal(failedNodeIds);
    }

    public RouteDiscoveryEngine getEngine() {
        return engine;
    }

    public FailSafeExecutor getExecutor() {
        return executor;
    }

    RouteResult directNeighbors(String failedNodeId, String targetNodeId) {
        long start = System.nanoTime();
        List<List<String>> routes = new ArrayList<>();
        for (String neighbor : linkMap.getOrDefault(targetNodeId, List.of())) {
            if (routes.size() >= maxRoutes) {
                break;
            }
            if (!neighbor.equals(failedNodeId)) {
                routes.add(List.of(targetNodeId, neighbor));
            }
        }
        return new RouteResult(routes, routes.isEmpty() ? 0 : 1, Duration.ofNanos(System.nanoTime() - start));
    }
}
