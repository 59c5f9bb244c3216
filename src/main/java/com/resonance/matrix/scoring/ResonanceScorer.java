package com.resonance.matrix.scoring;

import com.resonance.matrix.core.model.Node;
import com.resonance.matrix.core.model.Signal;
import com.resonance.matrix.loader.Keys;
import com.resonance.matrix.metrics.MetricsService;
import com.resonance.matrix.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies usage signals to node resonance and decays nodes afterwards.
 *
 * <p>Signal boost (with default weights):</p>
 * <pre>
 * boost = min(ctr, 0.25) * 4 + min(dwell / 60, 5) * 0.3
 *       + min(traversalDepth, 5) * 0.15 + min(returnVisits, 5) * 0.2
 * resonance = max(0.5, resonance + boost)
 * </pre>
 *
 * <p>Decay, applied once per run after all signals:</p>
 * <ul>
 *   <li>no signal in this run: {@code decay = min(0.3, decay + 0.05)},
 *       {@code resonance = max(0.5, resonance - 0.05)}</li>
 *   <li>otherwise, by the age of {@code lastUpdated}: {@code decay = min(0.5, ageDays * 0.01)},
 *       {@code resonance = max(0.5, resonance - decay)}</li>
 * </ul>
 */
public class ResonanceScorer {
    private static final Logger log = LoggerFactory.getLogger(ResonanceScorer.class);

    private static final double SECONDS_PER_DAY = 86400.0;

    private final ScoringWeights weights;
    private final Clock clock;
    private final MetricsService metrics;

    public ResonanceScorer() {
        this(ScoringWeights.defaults(), Clock.systemUTC(), new NoOpMetricsService());
    }

    public ResonanceScorer(ScoringWeights weights, Clock clock, MetricsService metrics) {
        this.weights = weights;
        this.clock = clock;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    /**
     * Applies every signal, then decays every node. Nodes are mutated in place.
     */
    public ScoringReport score(List<Node> nodes, Collection<Signal> signals) {
        Instant now = clock.instant();
        Map<String, Node> byId = new HashMap<>();
        Map<String, Node> byPath = new HashMap<>();
        for (Node node : nodes) {
            byId.put(node.getId(), node);
            String path = Keys.normalizePath(node.getPath());
            if (path != null) {
                byPath.put(path, node);
            }
        }

        // Node equality is by id, so membership is tracked per instance.
        Set<Node> touched = Collections.newSetFromMap(new IdentityHashMap<>());
        int applied = 0;
        int dropped = 0;
        for (Signal signal : signals) {
            Node target = resolve(signal, byId, byPath);
            if (target == null) {
                dropped++;
                log.debug("scoring.signal.dropped nodeId={} path={}", signal != null ? signal.nodeId() : null,
                        signal != null ? signal.path() : null);
                continue;
            }
            applySignal(target, signal, now);
            touched.add(target);
            applied++;
        }

        int unobserved = 0;
        int byAge = 0;
        for (Node node : nodes) {
            if (!touched.contains(node) || node.getLastUpdated() == null) {
                decayUnobserved(node);
                unobserved++;
            } else {
                decayByAge(node, now);
                byAge++;
            }
        }

        metrics.incrementSignalsApplied(applied);
        metrics.incrementSignalsDropped(dropped);
        ScoringReport report = new ScoringReport(applied, dropped, unobserved, byAge);
        log.info("scoring.completed nodes={} touched={} report={}", nodes.size(), touched.size(), report);
        return report;
    }

    /**
     * Computes the resonance boost of a single signal.
     */
    public double scoreBoost(Signal signal) {
        double ctr = Math.max(0.0, signal.effectiveCtr());
        return Math.min(ctr, weights.ctrCap()) * weights.ctrWeight()
                + Math.min(Math.max(0.0, signal.dwellSeconds()) / 60.0, weights.dwellCapMinutes()) * weights.dwellWeight()
                + Math.min(Math.max(0.0, signal.traversalDepth()), weights.depthCap()) * weights.depthWeight()
                + Math.min(Math.max(0.0, signal.returnVisits()), weights.returnCap()) * weights.returnWeight();
    }

    void applySignal(Node node, Signal signal, Instant now) {
        double boost = scoreBoost(signal);
        node.setResonanceScore(floor(node.getResonanceScore() + boost));
        node.setLastUpdated(signal.timestamp() != null ? signal.timestamp() : now);
        log.trace("scoring.signal.applied nodeId={} boost={} resonance={}",
                node.getId(), boost, node.getResonanceScore());
    }

    void decayUnobserved(Node node) {
        node.setDecayScore(Math.min(weights.unobservedDecayCap(), node.getDecayScore() + weights.unobservedDecayStep()));
        node.setResonanceScore(floor(node.getResonanceScore() - weights.unobservedDecayStep()));
    }

    void decayByAge(Node node, Instant now) {
        double ageDays = Math.max(0.0, Duration.between(node.getLastUpdated(), now).toMillis() / 1000.0 / SECONDS_PER_DAY);
        double decay = Math.min(weights.ageDecayCap(), ageDays * weights.ageDecayPerDay());
        node.setDecayScore(decay);
        node.setResonanceScore(floor(node.getResonanceScore() - decay));
    }

    private Node resolve(Signal signal, Map<String, Node> byId, Map<String, Node> byPath) {
        if (signal == null) {
            return null;
        }
        if (signal.nodeId() != null) {
            Node node = byId.get(signal.nodeId());
            if (node != null) {
                return node;
            }
        }
        String path = Keys.normalizePath(signal.path());
        return path != null ? byPath.get(path) : null;
    }

    private double floor(double score) {
        return Math.max(weights.resonanceFloor(), score);
    }

    public ScoringWeights getWeights() {
        return weights;
    }
}
