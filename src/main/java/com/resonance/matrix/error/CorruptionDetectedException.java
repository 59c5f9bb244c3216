package com.resonance.matrix.error;

/**
 * Structural inconsistency in the input or persisted run state.
 * The run aborts and the most recent checkpoint is left untouched.
 */
public class CorruptionDetectedException extends MatrixException {

    public CorruptionDetectedException(String message) {
        super(message);
    }

    public CorruptionDetectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
