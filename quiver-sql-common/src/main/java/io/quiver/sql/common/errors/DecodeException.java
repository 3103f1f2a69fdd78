package io.quiver.sql.common.errors;

/**
 * The result stream could not be decoded into record batches.
 */
public class DecodeException extends QuiverException {

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
