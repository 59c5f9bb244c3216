package com.resonance.matrix.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A content unit of the graph.
 *
 * <p>Identity and structure are immutable once built. Only the score fields
 * ({@code resonanceScore}, {@code decayScore}, {@code lastUpdated}) change, and only
 * through the resonance scorer.</p>
 */
@JsonDeserialize(builder = Node.Builder.class)
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"id", "type", "path", "title", "tags", "cluster", "inboundLinks", "outboundLinks",
        "connectsTo", "resonanceScore", "decayScore", "linkWeight", "lastUpdated"})
public final class Node {

    public static final double DEFAULT_RESONANCE = 1.0;
    public static final double DEFAULT_LINK_WEIGHT = 1.0;

    private final String id;
    private final NodeType type;
    private final String path;
    private final String title;
    private final Set<String> tags;
    private final String cluster;
    private final List<String> inboundLinks;
    private final List<String> outboundLinks;
    private final List<String> connectsTo;
    private final double linkWeight;
    private double resonanceScore;
    private double decayScore;
    private Instant lastUpdated;

    private Node(Builder builder) {
        this.id = builder.id;
        this.type = builder.type;
        this.path = builder.path;
        this.title = builder.title;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
        this.cluster = builder.cluster;
        this.inboundLinks = List.copyOf(builder.inboundLinks);
        this.outboundLinks = List.copyOf(builder.outboundLinks);
        this.connectsTo = List.copyOf(builder.connectsTo);
        this.linkWeight = builder.linkWeight;
        this.resonanceScore = builder.resonanceScore;
        this.decayScore = builder.decayScore;
        this.lastUpdated = builder.lastUpdated;
    }

    public String getId() {
        return id;
    }

    public NodeType getType() {
        return type;
    }

    public String getPath() {
        return path;
    }

    public String getTitle() {
        return title;
    }

    public Set<String> getTags() {
        return tags;
    }

    public String getCluster() {
        return cluster;
    }

    public List<String> getInboundLinks() {
        return inboundLinks;
    }

    public List<String> getOutboundLinks() {
        return outboundLinks;
    }

    public List<String> getConnectsTo() {
        return connectsTo;
    }

    public double getLinkWeight() {
        return linkWeight;
    }

    public double getResonanceScore() {
        return resonanceScore;
    }

    public double getDecayScore() {
        return decayScore;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public void setResonanceScore(double resonanceScore) {
        this.resonanceScore = resonanceScore;
    }

    public void setDecayScore(double decayScore) {
        this.decayScore = decayScore;
    }

    public void setLastUpdated(Instant lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node node = (Node) o;
        return Objects.equals(id, node.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Node{" +
                "id='" + id + '\'' +
                ", cluster='" + cluster + '\'' +
                ", resonance=" + resonanceScore +
                ", decay=" + decayScore +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String id;
        private NodeType type;
        private String path;
        private String title;
        private Collection<String> tags = List.of();
        private String cluster;
        private List<String> inboundLinks = List.of();
        private List<String> outboundLinks = List.of();
        private List<String> connectsTo = List.of();
        private double linkWeight = DEFAULT_LINK_WEIGHT;
        private double resonanceScore = DEFAULT_RESONANCE;
        private double decayScore = 0.0;
        private Instant lastUpdated;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(NodeType type) {
            this.type = type;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder tags(Collection<String> tags) {
            this.tags = tags != null ? tags : List.of();
            return this;
        }

        public Builder cluster(String cluster) {
            this.cluster = cluster;
            return this;
        }

        public Builder inboundLinks(List<String> inboundLinks) {
            this.inboundLinks = withoutNulls(inboundLinks);
            return this;
        }

        public Builder outboundLinks(List<String> outboundLinks) {
            this.outboundLinks = withoutNulls(outboundLinks);
            return this;
        }

        public Builder connectsTo(List<String> connectsTo) {
            this.connectsTo = withoutNulls(connectsTo);
            return this;
        }

        public Builder linkWeight(double linkWeight) {
            this.linkWeight = linkWeight;
            return this;
        }

        public Builder resonanceScore(double resonanceScore) {
            this.resonanceScore = resonanceScore;
            return this;
        }

        public Builder decayScore(double decayScore) {
            this.decayScore = decayScore;
            return this;
        }

        public Builder lastUpdated(Instant lastUpdated) {
            this.lastUpdated = lastUpdated;
            return this;
        }

        public Node build() {
            return new Node(this);
        }

        private static List<String> withoutNulls(List<String> values) {
            if (values == null) {
                return List.of();
            }
            List<String> copy = new ArrayList<>(values.size());
            for (String value : values) {
                if (value != null) {
                    copy.add(value);
                }
            }
            return copy;
        }
    }
}
