package io.quiver.sql.common.options;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Factory of {@link Option} overrides and the resolver that applies them.
 * <p>
 * Resolution copies the defaults into a fresh {@link Draft} and applies the overrides in list
 * order, so the last override of a field wins. Defaults are never modified.
 * <pre>{@code
 * QueryOptions options = Options.queryOptions(QueryOptions.DEFAULTS, Options.withDatabase("events"));
 * }</pre>
 */
public final class Options {

    private Options() {
    }

    public static Option withDatabase(String database) {
        Objects.requireNonNull(database, "database must not be null");
        return draft -> {
            draft.queryDatabase = database;
            draft.writeDatabase = database;
        };
    }

    public static Option withQueryType(QueryType queryType) {
        Objects.requireNonNull(queryType, "queryType must not be null");
        return draft -> draft.queryType = queryType;
    }

    public static Option withHeader(String name, String value) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        return draft -> draft.headers.put(name, value);
    }

    public static Option withPrecision(WritePrecision precision) {
        Objects.requireNonNull(precision, "precision must not be null");
        return draft -> draft.precision = precision;
    }

    public static Option withGzipThreshold(int gzipThreshold) {
        if (gzipThreshold < 0) {
            throw new IllegalArgumentException("gzipThreshold must be non-negative");
        }
        return draft -> draft.gzipThreshold = gzipThreshold;
    }

    public static Option withDefaultTags(Map<String, String> tags) {
        var copy = Map.copyOf(tags);
        return draft -> {
            draft.defaultTags.clear();
            draft.defaultTags.putAll(copy);
        };
    }

    public static QueryOptions queryOptions(QueryOptions defaults, Option... overrides) {
        return resolve(defaults, null, Arrays.asList(overrides)).query();
    }

    public static WriteOptions writeOptions(WriteOptions defaults, Option... overrides) {
        return resolve(null, defaults, Arrays.asList(overrides)).write();
    }

    /**
     * @param queryDefaults copied into the query half when not null
     * @param writeDefaults copied into the write half when not null
     * @param overrides     applied in order; must not contain null
     */
    public static ResolvedOptions resolve(QueryOptions queryDefaults, WriteOptions writeDefaults,
                                          List<Option> overrides) {
        var draft = new Draft();
        if (queryDefaults != null) {
            draft.copyFrom(queryDefaults);
        }
        if (writeDefaults != null) {
            draft.copyFrom(writeDefaults);
        }
        for (Option override : overrides) {
            Objects.requireNonNull(override, "option must not be null").apply(draft);
        }
        return new ResolvedOptions(draft.toQueryOptions(), draft.toWriteOptions());
    }

    /**
     * Mutable state an {@link Option} works on. Holds the query half and the write half so one
     * override type serves both; a fresh draft starts from zero values.
     */
    public static final class Draft {
        private String queryDatabase = "";
        private QueryType queryType = QueryType.FLIGHT_SQL;
        private final Map<String, String> headers = new HashMap<>();

        private String writeDatabase = "";
        private WritePrecision precision = WritePrecision.NANOSECOND;
        private final Map<String, String> defaultTags = new HashMap<>();
        private int gzipThreshold;

        Draft() {
        }

        private void copyFrom(QueryOptions options) {
            queryDatabase = options.database();
            queryType = options.queryType();
            headers.putAll(options.headers());
        }

        private void copyFrom(WriteOptions options) {
            writeDatabase = options.database();
            precision = options.precision();
            defaultTags.putAll(options.defaultTags());
            gzipThreshold = options.gzipThreshold();
        }

        QueryOptions toQueryOptions() {
            return new QueryOptions(queryDatabase, queryType, headers);
        }

        WriteOptions toWriteOptions() {
            return new WriteOptions(writeDatabase, precision, defaultTags, gzipThreshold);
        }
    }
}
