package com.resonance.matrix.error;

/**
 * Destination for reportable failures. Implementations must not throw.
 */
@FunctionalInterface
public interface ErrorSink {

    void report(ErrorEvent event);

    ErrorSink NOOP = event -> {};
}
