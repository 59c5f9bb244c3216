package com.resonance.matrix.route;

import java.time.Duration;
import java.util.List;

/**
 * A broken link together with the routes that can replace it.
 *
 * @param from          source of the broken link
 * @param to            target of the broken link
 * @param alternatives  replacement routes
 * @param discoveryTime time spent finding them
 */
public record ReroutedLink(String from, String to, List<List<String>> alternatives, Duration discoveryTime) {
}
