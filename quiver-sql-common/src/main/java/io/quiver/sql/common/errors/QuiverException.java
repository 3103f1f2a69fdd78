package io.quiver.sql.common.errors;

/**
 * Base of every error raised by the client. All of them are unchecked and reach the caller
 * of the operation that triggered them.
 */
public class QuiverException extends RuntimeException {

    public QuiverException(String message) {
        super(message);
    }

    public QuiverException(String message, Throwable cause) {
        super(message, cause);
    }
}
