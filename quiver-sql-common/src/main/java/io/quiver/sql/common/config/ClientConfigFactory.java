package io.quiver.sql.common.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueType;
import io.quiver.sql.common.ConfigConstants;
import io.quiver.sql.common.errors.ConfigurationException;
import io.quiver.sql.common.options.QueryOptions;
import io.quiver.sql.common.options.QueryType;
import io.quiver.sql.common.options.WriteOptions;
import io.quiver.sql.common.options.WritePrecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Creates {@link ClientConfig} instances from HOCON configuration.
 *
 * <p>Expected configuration format:</p>
 * <pre>{@code
 * quiver_client {
 *   host = "https://localhost:8181"
 *   token = "my-token"
 *   database = "metrics"
 *   timeout_ms = 0
 *   disable_server_certificate_verification = false
 *
 *   query {
 *     type = "flight_sql"
 *     headers { }
 *   }
 *
 *   write {
 *     precision = "ns"
 *     gzip_threshold = 1000
 *     default_tags { rack = "main" }
 *   }
 * }
 * }</pre>
 * The bundled {@code reference.conf} lets {@code QUIVER_HOST}, {@code QUIVER_TOKEN},
 * {@code QUIVER_DATABASE}, {@code QUIVER_PRECISION} and {@code QUIVER_GZIP_THRESHOLD} override
 * the defaults.
 */
public final class ClientConfigFactory {

    private static final Logger logger = LoggerFactory.getLogger(ClientConfigFactory.class);

    private ClientConfigFactory() {
    }

    /**
     * Classpath configuration with system properties on top.
     */
    public static ClientConfig load() {
        return fromConfig(ConfigFactory.load().getConfig(ConfigConstants.CONFIG_PATH));
    }

    /**
     * External file over classpath configuration, system properties over both.
     */
    public static ClientConfig load(Path externalConfig) {
        if (!Files.exists(externalConfig)) {
            throw new ConfigurationException("Configuration file not found: " + externalConfig);
        }
        logger.info("Loading client configuration from {}", externalConfig);
        Config config = ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.parseFile(externalConfig.toFile()))
                .withFallback(ConfigFactory.load())
                .resolve();
        return fromConfig(config.getConfig(ConfigConstants.CONFIG_PATH));
    }

    /**
     * @param config the {@code quiver_client} section
     */
    public static ClientConfig fromConfig(Config config) {
        try {
            var builder = ClientConfig.builder()
                    .host(config.getString(ConfigConstants.HOST_KEY))
                    .token(config.getString(ConfigConstants.TOKEN_KEY))
                    .database(config.getString(ConfigConstants.DATABASE_KEY))
                    .disableServerCertificateVerification(
                            config.getBoolean(ConfigConstants.DISABLE_SERVER_CERTIFICATE_VERIFICATION_KEY))
                    .queryOptions(queryOptions(config))
                    .writeOptions(writeOptions(config));
            long timeoutMs = config.getLong(ConfigConstants.TIMEOUT_MS_KEY);
            if (timeoutMs > 0) {
                builder.timeout(Duration.ofMillis(timeoutMs));
            }
            var clientConfig = builder.build();
            clientConfig.validate();
            return clientConfig;
        } catch (ConfigException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid client configuration: " + e.getMessage(), e);
        }
    }

    private static QueryOptions queryOptions(Config config) {
        return new QueryOptions(
                "",
                QueryType.fromString(config.getString(ConfigConstants.QUERY_TYPE_KEY)),
                stringMap(config, ConfigConstants.QUERY_HEADERS_KEY));
    }

    private static WriteOptions writeOptions(Config config) {
        return new WriteOptions(
                "",
                WritePrecision.fromString(config.getString(ConfigConstants.WRITE_PRECISION_KEY)),
                stringMap(config, ConfigConstants.WRITE_DEFAULT_TAGS_KEY),
                config.getInt(ConfigConstants.WRITE_GZIP_THRESHOLD_KEY));
    }

    /**
     * Keys are taken as written, so {@code "host.name" = a} yields the key {@code host.name}.
     * Values must be strings, numbers or booleans.
     */
    private static Map<String, String> stringMap(Config config, String path) {
        var result = new HashMap<String, String>();
        if (!config.hasPath(path)) {
            return result;
        }
        config.getObject(path).forEach((key, value) -> {
            var type = value.valueType();
            if (type != ConfigValueType.STRING && type != ConfigValueType.NUMBER && type != ConfigValueType.BOOLEAN) {
                throw new ConfigurationException("Invalid client configuration: " + path + " entry '" + key
                        + "' must be a string, found " + type.name().toLowerCase(Locale.ROOT));
            }
            result.put(key, String.valueOf(value.unwrapped()));
        });
        return result;
    }
}
