package com.resonance.matrix.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of content a node represents.
 */
public enum NodeType {
    GATE("gate"),
    PAIN_POINT("pain-point"),
    TOOL("tool"),
    INSIGHT("insight");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a wire name, returning null for unknown or missing values.
     */
    @JsonCreator
    public static NodeType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (NodeType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }
}
