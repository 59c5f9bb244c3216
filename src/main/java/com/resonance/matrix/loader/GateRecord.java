package com.resonance.matrix.loader;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A gate as stored in {@code gates.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GateRecord(String id, String title) {
}
