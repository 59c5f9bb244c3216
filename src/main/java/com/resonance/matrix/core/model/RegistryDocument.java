package com.resonance.matrix.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Contents of {@code registry.json}.
 */
public record RegistryDocument(String version, Instant generated, List<Node> nodes) {

    public RegistryDocument {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
    }
}
