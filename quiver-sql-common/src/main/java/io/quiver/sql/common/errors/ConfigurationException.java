package io.quiver.sql.common.errors;

/**
 * The local environment or the supplied configuration cannot produce a usable client,
 * e.g. the system trust store cannot be loaded or the host is missing.
 */
public class ConfigurationException extends QuiverException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
