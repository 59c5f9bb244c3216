package com.resonance.matrix.route;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a self-heal pass.
 *
 * <p>{@code success} is false when the pass took longer than its budget, even though the
 * routes are still returned; callers decide whether a late result is acceptable.</p>
 *
 * @param success   true when {@code elapsed <= budget}
 * @param rerouted  number of broken links for which alternatives were found
 * @param elapsed   total duration of the pass
 * @param budget    the budget the pass was measured against
 * @param routes    the rerouted links
 */
public record SelfHealReport(boolean success, int rerouted, Duration elapsed, Duration budget,
                             List<ReroutedLink> routes) {

    public SelfHealReport {
        routes = routes != null ? List.copyOf(routes) : List.of();
    }
}
