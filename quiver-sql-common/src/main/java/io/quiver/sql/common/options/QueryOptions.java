package io.quiver.sql.common.options;

import java.util.Map;
import java.util.Objects;

/**
 * Options of a single query.
 *
 * @param database  database to query; empty means the database configured on the client
 * @param queryType query dialect
 * @param headers   additional headers sent with every call of the query
 */
public record QueryOptions(String database, QueryType queryType, Map<String, String> headers) {

    public static final QueryOptions DEFAULTS = new QueryOptions("", QueryType.FLIGHT_SQL, Map.of());

    public QueryOptions {
        Objects.requireNonNull(database, "database must not be null");
        Objects.requireNonNull(queryType, "queryType must not be null");
        headers = Map.copyOf(headers);
    }

    public QueryOptions(String database, QueryType queryType) {
        this(database, queryType, Map.of());
    }
}
