package io.quiver.sql.common.options;

import java.util.Map;
import java.util.Objects;

/**
 * Options of a write.
 *
 * @param database      database to write to; empty means the database configured on the client
 * @param precision     precision of point timestamps
 * @param defaultTags   tags added to every point; a tag already present on the point is left unchanged
 * @param gzipThreshold bodies larger than this many bytes are gzipped, 0 disables compression
 */
public record WriteOptions(String database, WritePrecision precision, Map<String, String> defaultTags,
                           int gzipThreshold) {

    public static final int DEFAULT_GZIP_THRESHOLD = 1_000;

    public static final WriteOptions DEFAULTS =
            new WriteOptions("", WritePrecision.NANOSECOND, Map.of(), DEFAULT_GZIP_THRESHOLD);

    public WriteOptions {
        Objects.requireNonNull(database, "database must not be null");
        Objects.requireNonNull(precision, "precision must not be null");
        defaultTags = Map.copyOf(defaultTags);
        if (gzipThreshold < 0) {
            throw new IllegalArgumentException("gzipThreshold must be non-negative");
        }
    }
}
