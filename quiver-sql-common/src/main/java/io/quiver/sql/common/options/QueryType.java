package io.quiver.sql.common.options;

import java.util.Locale;

/**
 * Query dialect. {@link #FLIGHT_SQL} is the primary dialect and the default.
 */
public enum QueryType {
    FLIGHT_SQL,
    INFLUX_QL;

    public static QueryType fromString(String value) {
        var normalized = value.trim().toUpperCase(Locale.ROOT).replace("-", "_");
        return switch (normalized) {
            case "SQL", "FLIGHTSQL", "FLIGHT_SQL" -> FLIGHT_SQL;
            case "INFLUXQL", "INFLUX_QL" -> INFLUX_QL;
            default -> throw new IllegalArgumentException("Unknown query type: " + value);
        };
    }
}
