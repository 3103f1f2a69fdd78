package io.quiver.sql.common.errors;

/**
 * A protocol client could not be built against the target endpoint.
 */
public class ConnectionException extends QuiverException {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
