package com.resonance.matrix.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Review state of a generated recommendation or proposal.
 */
public enum RecommendationStatus {
    DRAFT,
    APPROVED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static RecommendationStatus fromWireName(String value) {
        return value == null ? DRAFT : valueOf(value.toUpperCase());
    }
}
