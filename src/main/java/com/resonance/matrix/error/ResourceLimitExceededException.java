package com.resonance.matrix.error;

import com.resonance.matrix.governor.ResourceReading;

/**
 * Thrown by the resource governor when a hard-kill threshold is crossed.
 */
public class ResourceLimitExceededException extends MatrixException {

    private final transient ResourceReading reading;

    public ResourceLimitExceededException(ResourceReading reading) {
        super("Hard kill: " + reading.reason());
        this.reading = reading;
    }

    public ResourceReading getReading() {
        return reading;
    }
}
