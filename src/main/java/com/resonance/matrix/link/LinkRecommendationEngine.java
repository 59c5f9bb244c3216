package com.resonance.matrix.link;

import com.resonance.matrix.core.model.LinkRecommendation;
import com.resonance.matrix.core.model.Node;
import com.resonance.matrix.core.model.RecommendationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recommends links from every node to the highest-resonance nodes of its cluster.
 *
 * <p>Nodes are grouped by cluster in registry order. Within a cluster the nodes are
 * stably sorted by resonance, descending, and the first {@code topK} become the hubs.
 * Each remaining member receives a draft recommendation pointing at the hubs. Hubs
 * receive none. Nodes without a cluster are ignored.</p>
 */
public class LinkRecommendationEngine {
    private static final Logger log = LoggerFactory.getLogger(LinkRecommendationEngine.class);

    public static final String REASON = "promote high-resonance nodes within cluster";

    private static final Comparator<Node> BY_RESONANCE_DESC =
            Comparator.comparingDouble(Node::getResonanceScore).reversed();

    private final LinkConfig config;

    public LinkRecommendationEngine() {
        this(LinkConfig.defaults());
    }

    public LinkRecommendationEngine(LinkConfig config) {
        this.config = config;
    }

    public List<LinkRecommendation> recommend(List<Node> nodes) {
        List<LinkRecommendation> recommendations = new ArrayList<>();
        for (Map.Entry<String, List<Node>> cluster : groupByCluster(nodes).entrySet()) {
            List<Node> hubs = hubs(cluster.getValue());
            List<String> hubIds = hubs.stream().map(Node::getId).toList();
            for (Node member : cluster.getValue()) {
                if (hubIds.contains(member.getId())) {
                    continue;
                }
                recommendations.add(new LinkRecommendation(member.getId(), hubIds, cluster.getKey(),
                        REASON, RecommendationStatus.DRAFT));
            }
        }
        log.info("links.recommended nodes={} recommendations={}", nodes.size(), recommendations.size());
        return recommendations;
    }

    /**
     * Returns the hub set of one cluster: at most {@code topK} nodes, highest resonance
     * first, ties kept in registry order.
     */
    public List<Node> hubs(List<Node> clusterMembers) {
        List<Node> sorted = new ArrayList<>(clusterMembers);
        sorted.sort(BY_RESONANCE_DESC);
        return List.copyOf(sorted.subList(0, Math.min(config.topK(), sorted.size())));
    }

    Map<String, List<Node>> groupByCluster(List<Node> nodes) {
        Map<String, List<Node>> byCluster = new LinkedHashMap<>();
        for (Node node : nodes) {
            if (node.getCluster() == null) {
                continue;
            }
            byCluster.computeIfAbsent(node.getCluster(), k -> new ArrayList<>()).add(node);
        }
        return byCluster;
    }
}
