package io.quiver.sql.common.config;

import io.quiver.sql.common.errors.ConfigurationException;
import io.quiver.sql.common.options.QueryOptions;
import io.quiver.sql.common.options.WriteOptions;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of a client.
 * Use the builder; {@link #validate()} is called by the client before it connects.
 *
 * @param host     server URL; {@code https://} and no scheme use TLS, {@code http://} uses plaintext
 * @param token    bearer token, empty for servers without authentication
 * @param database database used when a call does not name one
 * @param timeout  deadline applied to every call, null for none
 */
public record ClientConfig(
        String host,
        String token,
        String database,
        QueryOptions queryOptions,
        WriteOptions writeOptions,
        boolean disableServerCertificateVerification,
        Duration timeout
) {
    public ClientConfig {
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(database, "database must not be null");
        Objects.requireNonNull(queryOptions, "queryOptions must not be null");
        Objects.requireNonNull(writeOptions, "writeOptions must not be null");
    }

    public void validate() {
        if (host == null || host.isBlank()) {
            throw new ConfigurationException("host must be set");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new ConfigurationException("timeout must be positive");
        }
    }

    /** Token is not part of the string form. */
    @Override
    public String toString() {
        return "ClientConfig[host=" + host + ", database=" + database + ", queryOptions=" + queryOptions
                + ", writeOptions=" + writeOptions + ", disableServerCertificateVerification="
                + disableServerCertificateVerification + ", timeout=" + timeout + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host;
        private String token = "";
        private String database = "";
        private QueryOptions queryOptions = QueryOptions.DEFAULTS;
        private WriteOptions writeOptions = WriteOptions.DEFAULTS;
        private boolean disableServerCertificateVerification = false;
        private Duration timeout;

        private Builder() {
        }

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host);
            return this;
        }

        public Builder token(String token) {
            this.token = Objects.requireNonNull(token);
            return this;
        }

        public Builder database(String database) {
            this.database = Objects.requireNonNull(database);
            return this;
        }

        public Builder queryOptions(QueryOptions queryOptions) {
            this.queryOptions = Objects.requireNonNull(queryOptions);
            return this;
        }

        public Builder writeOptions(WriteOptions writeOptions) {
            this.writeOptions = Objects.requireNonNull(writeOptions);
            return this;
        }

        public Builder disableServerCertificateVerification(boolean disable) {
            this.disableServerCertificateVerification = disable;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(
                    host,
                    token,
                    database,
                    queryOptions,
                    writeOptions,
                    disableServerCertificateVerification,
                    timeout
            );
        }
    }
}
