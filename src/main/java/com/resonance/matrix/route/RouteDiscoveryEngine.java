package com.resonance.matrix.route;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.resonance.matrix.core.model.LinkRecommendation;
import com.resonance.matrix.logging.LogContext;
import com.resonance.matrix.metrics.MetricsService;
import com.resonance.matrix.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Finds replacement routes through the link graph when nodes fail.
 *
 * <p>For a query {@code (failed, target)} the direct outbound neighbors of
 * {@code target}, minus every failed node, are returned as depth-1 routes without further
 * search. When none remain, a breadth-first search along outbound links starts at
 * {@code target}, never entering a failed node and never exceeding {@code maxDepth}
 * edges. Links are only followed from source to target. Any reached node that itself has
 * outbound links ends a route. At most {@code maxRoutes} routes are returned; no path
 * yields an empty result.</p>
 *
 * <p>Results are cached per {@code (failed, target)} for the life of the engine. Marking
 * further nodes as failed invalidates the cache.</p>
 */
public class RouteDiscoveryEngine {
    private static final Logger log = LoggerFactory.getLogger(RouteDiscoveryEngine.class);

    private final RouteConfig config;
    private final Ticker ticker;
    private final MetricsService metrics;
    private final List<LinkRecommendation> recommendations;
    private final Map<String, List<String>> outbound;
    private final Set<String> failedNodes = ConcurrentHashMap.newKeySet();
    private final Cache<RouteKey, RouteResult> routeCache;

    public RouteDiscoveryEngine(List<LinkRecommendation> recommendations) {
        this(recommendations, RouteConfig.defaults(), Ticker.systemTicker(), new NoOpMetricsService());
    }

    public RouteDiscoveryEngine(List<LinkRecommendation> recommendations, RouteConfig config,
                                Ticker ticker, MetricsService metrics) {
        this.config = config;
        this.ticker = ticker;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.recommendations = List.copyOf(recommendations);
        this.outbound = buildOutbound(this.recommendations);
        this.routeCache = Caffeine.newBuilder()
                .maximumSize(config.cacheSize())
                .recordStats()
                .build();
    }

    /**
     * Finds routes from {@code targetNodeId} that avoid {@code failedNodeId} and every node
     * previously marked as failed, using the configured maximum depth.
     */
    public RouteResult findAlternativeRoutes(String failedNodeId, String targetNodeId) {
        return findAlternativeRoutes(failedNodeId, targetNodeId, config.maxDepth());
    }

    public RouteResult findAlternativeRoutes(String failedNodeId, String targetNodeId, int maxDepth) {
        RouteKey key = new RouteKey(failedNodeId, targetNodeId, maxDepth);
        RouteResult cached = routeCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        RouteResult result = search(failedNodeId, targetNodeId, maxDepth);
        routeCache.put(key, result);
        return result;
    }

    /**
     * Reroutes every link touching a failed node and reports the pass against {@code budget}.
     *
     * <p>When a recommendation's source failed, each of its targets is rerouted. When one
     * of its targets failed, the source is rerouted around that target.</p>
     */
    public SelfHealReport selfHeal(Collection<String> failedNodeIds, Duration budget) {
        long start = ticker.read();
        Set<String> failed = new LinkedHashSet<>(failedNodeIds);
        markFailed(failed);
        List<ReroutedLink> rerouted = new ArrayList<>();

        try (LogContext ignored = LogContext.forSelfHeal(LogContext.generateRunId(), failed.size())) {
            for (LinkRecommendation rec : recommendations) {
                if (failed.contains(rec.from())) {
                    for (String target : rec.to()) {
                        RouteResult alternatives = findAlternativeRoutes(rec.from(), target);
                        if (!alternatives.isEmpty()) {
                            rerouted.add(new ReroutedLink(rec.from(), target, alternatives.routes(),
                                    alternatives.discoveryTime()));
                        }
                    }
                } else {
                    for (String target : rec.to()) {
                        if (!failed.contains(target)) {
                            continue;
                        }
                        RouteResult alternatives = findAlternativeRoutes(target, rec.from());
                        if (!alternatives.isEmpty()) {
                            rerouted.add(new ReroutedLink(rec.from(), target, alternatives.routes(),
                                    alternatives.discoveryTime()));
                        }
                    }
                }
            }

            Duration elapsed = Duration.ofNanos(ticker.read() - start);
            boolean success = elapsed.compareTo(budget) <= 0;
            metrics.recordRouteDiscovery(elapsed, success);
            if (success) {
                log.info("route.self_heal.completed failed={} rerouted={} elapsedMs={}",
                        failed.size(), rerouted.size(), elapsed.toMillis());
            } else {
                log.warn("route.self_heal.over_budget failed={} rerouted={} elapsedMs={} budgetMs={}",
                        failed.size(), rerouted.size(), elapsed.toMillis(), budget.toMillis());
            }
            return new SelfHealReport(success, rerouted.size(), elapsed, budget, rerouted);
        }
    }

    public SelfHealReport selfHeal(Collection<String> failedNodeIds) {
        return selfHeal(failedNodeIds, config.timeBudget());
    }

    /**
     * Registers nodes as failed. Cached routes are dropped when the set grows.
     */
    public void markFailed(Collection<String> nodeIds) {
        if (failedNodes.addAll(nodeIds)) {
            routeCache.invalidateAll();
            log.debug("route.failed.updated failedNodes={}", failedNodes.size());
        }
    }

    public long cacheSize() {
        return routeCache.estimatedSize();
    }

    public long cacheHits() {
        return routeCache.stats().hitCount();
    }

    private RouteResult search(String failedNodeId, String targetNodeId, int maxDepth) {
        long start = ticker.read();
        Set<String> excluded = new HashSet<>(failedNodes);
        excluded.add(failedNodeId);

        List<List<String>> direct = new ArrayList<>();
        for (String neighbor : outbound.getOrDefault(targetNodeId, List.of())) {
            if (!excluded.contains(neighbor) && !neighbor.equals(targetNodeId)) {
                direct.add(List.of(targetNodeId, neighbor));
                if (direct.size() >= config.maxRoutes()) {
                    break;
                }
            }
        }
        if (!direct.isEmpty()) {
            return new RouteResult(direct, 1, Duration.ofNanos(ticker.read() - start));
        }

        List<List<String>> routes = new ArrayList<>();
        Deque<List<String>> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>(excluded);
        visited.add(targetNodeId);
        queue.add(List.of(targetNodeId));

        while (!queue.isEmpty() && routes.size() < config.maxRoutes()) {
            List<String> path = queue.poll();
            if (path.size() - 1 >= maxDepth) {
                continue;
            }
            String current = path.get(path.size() - 1);
            for (String next : outbound.getOrDefault(current, List.of())) {
                if (!visited.add(next)) {
                    continue;
                }
                List<String> extended = new ArrayList<>(path);
                extended.add(next);
                if (!outbound.getOrDefault(next, List.of()).isEmpty()) {
                    routes.add(extended);
                    if (routes.size() >= config.maxRoutes()) {
                        break;
                    }
                }
                queue.add(extended);
            }
        }

        int depth = routes.isEmpty() ? 0 : routes.get(0).size() - 1;
        return new RouteResult(routes, depth, Duration.ofNanos(ticker.read() - start));
    }

    private static Map<String, List<String>> buildOutbound(List<LinkRecommendation> recommendations) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (LinkRecommendation rec : recommendations) {
            List<String> targets = map.computeIfAbsent(rec.from(), k -> new ArrayList<>());
            for (String to : rec.to()) {
                if (!targets.contains(to)) {
                    targets.add(to);
                }
            }
        }
        return map;
    }

    record RouteKey(String failedNodeId, String targetNodeId, int maxDepth) {}
}
