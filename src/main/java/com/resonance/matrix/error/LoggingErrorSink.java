package com.resonance.matrix.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes error events to the application log.
 */
public class LoggingErrorSink implements ErrorSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingErrorSink.class);

    @Override
    public void report(ErrorEvent event) {
        log.warn("matrix.error category={} nodeId={} message={}",
                event.category(), event.nodeId(), event.message());
    }
}
