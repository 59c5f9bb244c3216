package com.resonance.matrix.migration;

import com.resonance.matrix.core.model.MigratedNode;
import com.resonance.matrix.core.model.Node;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The gold-standard anchors of a run and the working set that pins them.
 *
 * <p>A node is an anchor when its id contains an anchor name or its cluster equals one.
 * Pinned anchors survive every flush of the migration buffer for the lifetime of the run.</p>
 */
public class GoldStandardAnchors {

    private final Set<String> names;
    private final Map<String, MigratedNode> pinned = new LinkedHashMap<>();

    public GoldStandardAnchors(Collection<String> names) {
        this.names = Set.copyOf(names);
    }

    public boolean isAnchor(Node node) {
        String id = node.getId();
        String cluster = node.getCluster();
        for (String name : names) {
            if ((id != null && id.contains(name)) || name.equals(cluster)) {
                return true;
            }
        }
        return false;
    }

    void pin(MigratedNode node) {
        pinned.put(node.id(), node);
    }

    public Map<String, MigratedNode> pinned() {
        return Collections.unmodifiableMap(pinned);
    }
}
