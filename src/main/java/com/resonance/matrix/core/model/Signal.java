package com.resonance.matrix.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Aggregate usage observation for a node, addressed either by node id or by path.
 *
 * <p>Numeric fields that are absent on the wire default to zero. {@code ctr} stays
 * null when absent so that {@link #effectiveCtr()} can derive it. A reported rate of
 * zero counts as not reported.</p>
 *
 * @param nodeId         target node id, may be null
 * @param path           target path, may be null
 * @param impressions    number of impressions
 * @param clicks         number of clicks
 * @param ctr            click-through rate, null when not reported
 * @param dwellSeconds   average dwell time in seconds
 * @param traversalDepth how deep into the graph the visit went
 * @param returnVisits   number of return visits
 * @param timestamp      observation time, may be null
 * @param source         origin of the signal, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Signal(
        String nodeId,
        String path,
        double impressions,
        double clicks,
        Double ctr,
        double dwellSeconds,
        double traversalDepth,
        double returnVisits,
        Instant timestamp,
        String source
) {

    /**
     * Resolves the click-through rate: the reported value when present and non-zero,
     * otherwise {@code clicks / impressions}, otherwise zero.
     */
    public double effectiveCtr() {
        if (ctr != null && ctr != 0.0) {
            return ctr;
        }
        return impressions > 0 ? clicks / impressions : 0.0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String nodeId;
        private String path;
        private double impressions;
        private double clicks;
        private Double ctr;
        private double dwellSeconds;
        private double traversalDepth;
        private double returnVisits;
        private Instant timestamp;
        private String source;

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder impressions(double impressions) {
            this.impressions = impressions;
            return this;
        }

        public Builder clicks(double clicks) {
            this.clicks = clicks;
            return this;
        }

        public Builder ctr(Double ctr) {
            this.ctr = ctr;
            return this;
        }

        public Builder dwellSeconds(double dwellSeconds) {
            this.dwellSeconds = dwellSeconds;
            return this;
        }

        public Builder traversalDepth(double traversalDepth) {
            this.traversalDepth = traversalDepth;
            return this;
        }

        public Builder returnVisits(double returnVisits) {
            this.returnVisits = returnVisits;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Signal build() {
            return new Signal(nodeId, path, impressions, clicks, ctr, dwellSeconds,
                    traversalDepth, returnVisits, timestamp, source);
        }
    }
}
