package io.quiver.sql.client;

import io.quiver.sql.common.errors.ConfigurationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Connection target extracted from the configured host.
 *
 * @param secure {@code TRUE} for {@code https}, {@code FALSE} for {@code http}, null when the host
 *               carries no scheme
 */
public record HostUrl(String host, int port, Boolean secure) {

    public static final int DEFAULT_TLS_PORT = 443;
    public static final int DEFAULT_PLAINTEXT_PORT = 80;

    /**
     * Hosts without a scheme are treated as secure.
     */
    public boolean isSecure() {
        return secure == null || secure;
    }

    public static HostUrl parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("host must be set");
        }
        var trimmed = value.trim();
        URI uri;
        try {
            uri = new URI(trimmed.contains("://") ? trimmed : "//" + trimmed);
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Invalid host: " + value, e);
        }
        Boolean secure = secure(uri.getScheme(), value);
        if (uri.getHost() == null) {
            throw new ConfigurationException("Invalid host: " + value);
        }
        int port = uri.getPort();
        if (port == -1) {
            port = Boolean.FALSE.equals(secure) ? DEFAULT_PLAINTEXT_PORT : DEFAULT_TLS_PORT;
        }
        return new HostUrl(uri.getHost(), port, secure);
    }

    private static Boolean secure(String scheme, String value) {
        if (scheme == null) {
            return null;
        }
        return switch (scheme.toLowerCase(Locale.ROOT)) {
            case "https", "grpc+tls" -> Boolean.TRUE;
            case "http", "grpc", "grpc+tcp" -> Boolean.FALSE;
            default -> throw new ConfigurationException("Unsupported scheme in host: " + value);
        };
    }
}
