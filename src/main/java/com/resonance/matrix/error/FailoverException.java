package com.resonance.matrix.error;

/**
 * Both the primary and the legacy implementation of an operation failed.
 */
public class FailoverException extends MatrixException {

    public FailoverException(String operation, Throwable primaryError, Throwable legacyError) {
        super("Both engines failed for '" + operation + "': "
                + describe(primaryError) + " | " + describe(legacyError), legacyError);
        addSuppressed(primaryError);
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
