package com.resonance.matrix.migration;

import com.resonance.matrix.core.model.Node;
import com.resonance.matrix.error.ValidationException;

import java.util.List;

/**
 * Rejects nodes that cannot be migrated: a missing or blank id, or an adjacency list
 * that points back at the node itself.
 */
public class NodeValidator {

    /**
     * @throws ValidationException when the node is invalid
     */
    public void validate(Node node, long index) {
        String id = node.getId();
        if (id == null || id.isBlank()) {
            throw new ValidationException(null, index, "Missing ID");
        }
        checkNoSelfReference(node, node.getConnectsTo(), "connectsTo", index);
        checkNoSelfReference(node, node.getOutboundLinks(), "outboundLinks", index);
        checkNoSelfReference(node, node.getInboundLinks(), "inboundLinks", index);
    }

    private void checkNoSelfReference(Node node, List<String> adjacency, String field, long index) {
        if (adjacency.contains(node.getId())) {
            throw new ValidationException(node.getId(), index, "Circular reference detected in " + field);
        }
    }
}
