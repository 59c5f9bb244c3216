package com.resonance.matrix.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Error Handling Tests")
class ErrorHandlingTest {

    @Test
    @DisplayName("Every failure should be a MatrixException")
    void hierarchy() {
        assertInstanceOf(MatrixException.class, new ValidationException("n", 3, "Missing ID"));
        assertInstanceOf(MatrixException.class, new CorruptionDetectedException("bad"));
        assertInstanceOf(MatrixException.class, new SourceUnavailableException(Path.of("x"), "gone"));
        assertInstanceOf(RuntimeException.class, new MatrixException("any"));
    }

    @Test
    @DisplayName("SourceUnavailableException should name the path and keep the cause")
    void sourceUnavailable() {
        IOException cause = new IOException("denied");
        SourceUnavailableException e = new SourceUnavailableException(Path.of("data", "gates.json"), "Cannot read", cause);

        assertEquals(Path.of("data", "gates.json"), e.getSource());
        assertTrue(e.getMessage().startsWith("Cannot read: "));
        assertSame(cause, e.getCause());
    }

    @Test
    @DisplayName("FailoverException should describe both failures")
    void failover() {
        IllegalStateException primary = new IllegalStateException("slow");
        RuntimeException legacy = new RuntimeException();

        FailoverException e = new FailoverException("route.discovery", primary, legacy);

        assertTrue(e.getMessage().contains("route.discovery"));
        assertTrue(e.getMessage().contains("slow | RuntimeException"));
        assertSame(legacy, e.getCause());
        assertSame(primary, e.getSuppressed()[0]);
    }

    @Test
    @DisplayName("Sinks should accept events without throwing")
    void sinks() {
        ErrorEvent event = ErrorEvent.of("validation", "node-1", "index 4: Missing ID");

        assertDoesNotThrow(() -> ErrorSink.NOOP.report(event));
        assertDoesNotThrow(() -> new LoggingErrorSink().report(event));
        assertNotNull(event.timestamp());
    }
}
