package com.resonance.matrix.migration;

import com.resonance.matrix.core.model.MigratedNode;
import com.resonance.matrix.core.model.Node;

/**
 * Maps a validated node to the migration output schema.
 *
 * <ul>
 *   <li>{@code ParentID}: the cluster, else the prefix of an {@code a::b} composite id, else null</li>
 *   <li>{@code RiskWeight}: {@code round(clamp(resonance * (1 - decay), 0, 1), 2)}</li>
 * </ul>
 */
public class NodeTransformer {

    private static final String COMPOSITE_SEPARATOR = "::";

    private final GoldStandardAnchors anchors;

    public NodeTransformer(GoldStandardAnchors anchors) {
        this.anchors = anchors;
    }

    public MigratedNode transform(Node node) {
        return new MigratedNode(
                node.getId(),
                parentId(node),
                riskWeight(node.getResonanceScore(), node.getDecayScore()),
                node.getType(),
                node.getTitle() != null ? node.getTitle() : node.getId(),
                node.getPath(),
                node.getCluster(),
                node.getResonanceScore(),
                node.getDecayScore(),
                node.getLinkWeight(),
                anchors.isAnchor(node));
    }

    static String parentId(Node node) {
        if (node.getCluster() != null && !node.getCluster().isEmpty()) {
            return node.getCluster();
        }
        String id = node.getId();
        int separator = id.indexOf(COMPOSITE_SEPARATOR);
        if (separator > 0) {
            return id.substring(0, separator);
        }
        return null;
    }

    static double riskWeight(double resonance, double decay) {
        double normalized = Math.max(0.0, Math.min(1.0, resonance * (1.0 - decay)));
        return Math.round(normalized * 100.0) / 100.0;
    }
}
