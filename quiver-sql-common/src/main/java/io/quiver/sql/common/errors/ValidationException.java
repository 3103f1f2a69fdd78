package io.quiver.sql.common.errors;

/**
 * Caller supplied arguments that can be rejected locally. Always raised before any remote call.
 */
public class ValidationException extends QuiverException {

    public ValidationException(String message) {
        super(message);
    }
}
