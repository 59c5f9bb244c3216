package com.resonance.matrix.route;

import java.time.Duration;
import java.util.List;

/**
 * Alternative routes found for one query.
 *
 * @param routes        node paths, each starting at the queried node
 * @param depth         edge count of the shortest route, 0 when none was found
 * @param discoveryTime time spent searching
 */
public record RouteResult(List<List<String>> routes, int depth, Duration discoveryTime) {

    public RouteResult {
        routes = routes != null ? routes.stream().map(List::copyOf).toList() : List.of();
    }

    public boolean isEmpty() {
        return routes.isEmpty();
    }
}
