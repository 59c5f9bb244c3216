package com.resonance.matrix.error;

import java.time.Instant;

/**
 * A reportable failure forwarded to an {@link ErrorSink}.
 *
 * @param timestamp when the failure was observed
 * @param category  short machine-readable category, e.g. {@code validation} or {@code abort}
 * @param nodeId    related node id, may be null
 * @param message   human readable description
 */
public record ErrorEvent(Instant timestamp, String category, String nodeId, String message) {

    public static ErrorEvent of(String category, String nodeId, String message) {
        return new ErrorEvent(Instant.now(), category, nodeId, message);
    }
}
