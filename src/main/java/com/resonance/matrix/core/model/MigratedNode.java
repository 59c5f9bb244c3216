package com.resonance.matrix.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Output schema of the streaming migration.
 */
@JsonPropertyOrder({"ID", "ParentID", "RiskWeight", "type", "title", "path", "cluster",
        "resonanceScore", "decayScore", "linkWeight", "isGoldStandard"})
public record MigratedNode(
        @JsonProperty("ID") String id,
        @JsonProperty("ParentID") String parentId,
        @JsonProperty("RiskWeight") double riskWeight,
        @JsonProperty("type") NodeType type,
        @JsonProperty("title") String title,
        @JsonProperty("path") String path,
        @JsonProperty("cluster") String cluster,
        @JsonProperty("resonanceScore") double resonanceScore,
        @JsonProperty("decayScore") double decayScore,
        @JsonProperty("linkWeight") double linkWeight,
        @JsonProperty("isGoldStandard") boolean goldStandard
) {
}
