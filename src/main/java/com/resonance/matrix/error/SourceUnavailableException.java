package com.resonance.matrix.error;

import java.nio.file.Path;

/**
 * A required input could not be read.
 */
public class SourceUnavailableException extends MatrixException {

    private final Path source;

    public SourceUnavailableException(Path source, String message) {
        super(message + ": " + source);
        this.source = source;
    }

    public SourceUnavailableException(Path source, String message, Throwable cause) {
        super(message + ": " + source, cause);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
