package com.resonance.matrix.error;

/**
 * Base type for all failures raised by the resonance matrix library.
 */
public class MatrixException extends RuntimeException {

    public MatrixException(String message) {
        super(message);
    }

    public MatrixException(String message, Throwable cause) {
        super(message, cause);
    }
}
