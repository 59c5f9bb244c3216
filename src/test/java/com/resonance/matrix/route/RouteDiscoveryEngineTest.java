package com.resonance.matrix.route;

import com.github.benmanes.caffeine.cache.Ticker;
import com.resonance.matrix.core.model.LinkRecommendation;
import com.resonance.matrix.core.model.RecommendationStatus;
import com.resonance.matrix.metrics.MetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("RouteDiscoveryEngine Tests")
class RouteDiscoveryEngineTest {

    @Mock
    private MetricsService metrics;

    @Nested
    @DisplayName("Alternative routes")
    class AlternativeRoutes {

        @Test
        @DisplayName("Direct neighbors other than the failed node should be returned at depth 1")
        void directNeighbors() {
            RouteDiscoveryEngine engine = new RouteDiscoveryEngine(List.of(
                    rec("t", "a", "f", "b")));

            RouteResult result = engine.findAlternativeRoutes("f", "t");

            assertEquals(List.of(List.of("t", "a"), List.of("t", "b")), result.routes());
            assertEquals(1, result.depth());
        }

        @Test
        @DisplayName("Nodes linking into the target should not become routes")
        void inboundLinksNotFollowed() {
            RouteDiscoveryEngine engine = new RouteDiscoveryEngine(List.of(
                    rec("t", "f"),
                    rec("m", "t")));

            RouteResult result = engine.findAlternativeRoutes("f", "t");

            assertTrue(result.isEmpty());
            assertEquals(0, result.depth());
        }

        @Test
        @DisplayName("Direct routes should only use outbound links of the target")
        void directRoutesForwardOnly() {
            RouteDiscoveryEngine engine = new RouteDiscoveryEngine(List.of(
                    rec("t", "f", "a"),
                    rec("b", "t"),
                    rec("a", "c")));

            RouteResult result = engine.findAlternativeRoutes("f", "t");

            assertEquals(List.of(List.of("t", "a")), result.routes());
            assertEquals(1, result.depth());
        }

        @Test
        @DisplayName("Search should not reach nodes behind a failure or upstream of the target")
        void noDetourThroughFailureOrBackwards() {
            // t -> f -> g -> h; x -> t, k; j -> k
            List<LinkRecommendation> recs = List.of(
                    rec("t", "f"),
                    rec("f", "g"),
                    rec("g", "h"),
                    rec("x", "t", "k"),
                    rec("j", "k"));

            RouteResult result = new RouteDiscoveryEngine(recs).findAlternativeRoutes("f", "t", 3);

            assertTrue(result.isEmpty());
        }

        @Test
        @DisplayName("No path should give an empty result")
        void noPath() {
            RouteDiscoveryEngine engine = new RouteDiscoveryEngine(List.of(rec("t", "f")));

            RouteResult result = engine.findAlternativeRoutes("f", "t");

            assertTrue(result.isEmpty());
            assertEquals(0, result.depth());
        }

        @Test
        @DisplayName("At most five routes should be returned")
        void routeCap() {
            RouteDiscoveryEngine engine = new RouteDiscoveryEngine(List.of(
                    rec("t", "a", "b", "c", "d", "e", "g", "h")));
            assertEquals(5, engine.findAlternativeRoutes("f", "t").routes().size());
        }
    }

    @Nested
    @DisplayName("Route cache")
    class Cache {

        @Test
        @DisplayName("Repeated queries should be served from the cache")
        void cachedQueries() {
            RouteDiscoveryEngine engine = new RouteDiscoveryEngine(List.of(rec("t", "a", "f")));

            RouteResult first = engine.findAlternativeRoutes("f", "t");
            RouteResult second = engine.findAlternativeRoutes("f", "t");

            assertSame(first, second);
            assertEquals(1, engine.cacheHits());
        }

        @Test
        @DisplayName("Marking new failures should invalidate cached routes")
        void invalidation() {
            RouteDiscoveryEngine engine = new RouteDiscoveryEngine(List.of(rec("t", "a", "b")));

            assertEquals(2, engine.findAlternativeRoutes("x", "t").routes().size());
            engine.markFailed(Set.of("a"));
            assertEquals(0, engine.cacheSize());

            assertEquals(List.of(List.of("t", "b")), engine.findAlternativeRoutes("x", "t").routes());
        }
    }

    @Nested
    @DisplayName("Self-heal")
    class SelfHeal {

        @Test
        @DisplayName("Links into a failed hub should be rerouted within budget")
        void reroutesFailedHub() {
            AtomicLong nanos = new AtomicLong();
            Ticker ticker = () -> nanos.addAndGet(Duration.ofMillis(1).toNanos());
            RouteDiscoveryEngine engine = new RouteDiscoveryEngine(List.of(
                    rec("a", "h1", "h2"),
                    rec("b", "h1", "h2")),
                    RouteConfig.defaults(), ticker, metrics);

            SelfHealReport report = engine.selfHeal(List.of("h1"));

            assertTrue(report.success());
            assertEquals(2, report.rerouted());
            assertEquals(List.of(List.of("a", "h2")), report.routes().get(0).alternatives());
            verify(metrics).recordRouteDiscovery(any(Duration.class), eq(true));
        }

        @Test
        @DisplayName("A pass slower than the budget should be reported as unsuccessful")
        void overBudget() {
            AtomicLong nanos = new AtomicLong();
            Ticker slow = () -> nanos.addAndGet(Duration.ofMillis(100).toNanos());
            RouteDiscoveryEngine engine = new RouteDiscoveryEngine(List.of(rec("a", "h1", "h2")),
                    RouteConfig.defaults(), slow, metrics);

            SelfHealReport report = engine.selfHeal(List.of("a"));

            assertFalse(report.success());
            assertEquals(Duration.ofMillis(50), report.budget());
        }
    }

    private static LinkRecommendation rec(String from, String... to) {
        return new LinkRecommendation(from, List.of(to), "c", "test", RecommendationStatus.DRAFT);
    }
}
