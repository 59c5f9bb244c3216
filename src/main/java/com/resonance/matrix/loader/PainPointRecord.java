package com.resonance.matrix.loader;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A pain point as stored in {@code pain-points.json}, keyed by gate.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PainPointRecord(String id, String title) {
}
