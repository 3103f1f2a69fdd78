package io.quiver.sql.common.options;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OptionsTest {

    @Test
    void resolve_shouldNotMutateDefaults() {
        var queryDefaults = new QueryOptions("metrics", QueryType.FLIGHT_SQL, Map.of("trace", "1"));
        var writeDefaults = new WriteOptions("metrics", WritePrecision.NANOSECOND, Map.of("rack", "main"), 1_000);

        Options.resolve(queryDefaults, writeDefaults, List.of(
                Options.withDatabase("events"),
                Options.withQueryType(QueryType.INFLUX_QL),
                Options.withHeader("trace", "2"),
                Options.withPrecision(WritePrecision.SECOND),
                Options.withGzipThreshold(0),
                Options.withDefaultTags(Map.of("host", "a"))));

        var again = Options.resolve(queryDefaults, writeDefaults, List.of());
        assertEquals(queryDefaults, again.query());
        assertEquals(writeDefaults, again.write());
        assertEquals("metrics", queryDefaults.database());
        assertEquals(Map.of("trace", "1"), queryDefaults.headers());
        assertEquals(Map.of("rack", "main"), writeDefaults.defaultTags());
        assertEquals(1_000, writeDefaults.gzipThreshold());
    }

    @Test
    void resolve_sharedDefaultsStayUnchanged() {
        Options.queryOptions(QueryOptions.DEFAULTS, Options.withDatabase("x"), Options.withHeader("a", "b"));
        Options.writeOptions(WriteOptions.DEFAULTS, Options.withGzipThreshold(5), Options.withDefaultTags(Map.of("k", "v")));

        assertEquals(new QueryOptions("", QueryType.FLIGHT_SQL, Map.of()), QueryOptions.DEFAULTS);
        assertEquals(new WriteOptions("", WritePrecision.NANOSECOND, Map.of(), 1_000), WriteOptions.DEFAULTS);
    }

    @Test
    void resolve_lastOverrideWins() {
        for (int n = 1; n <= 5; n++) {
            var overrides = new ArrayList<Option>();
            for (int i = 0; i < n; i++) {
                overrides.add(Options.withDatabase("db" + i));
                overrides.add(Options.withGzipThreshold(i * 10));
            }
            var resolved = Options.resolve(QueryOptions.DEFAULTS, WriteOptions.DEFAULTS, overrides);
            assertEquals("db" + (n - 1), resolved.query().database());
            assertEquals("db" + (n - 1), resolved.write().database());
            assertEquals((n - 1) * 10, resolved.write().gzipThreshold());
        }
    }

    @Test
    void resolve_overridesApplyInOrder() {
        var seen = new ArrayList<String>();
        Option first = draft -> seen.add("first");
        Option second = draft -> seen.add("second");

        Options.queryOptions(QueryOptions.DEFAULTS, first, second);

        assertEquals(List.of("first", "second"), seen);
    }

    @Test
    void queryOptions_shouldKeepDefaultsWithoutOverrides() {
        var defaults = new QueryOptions("metrics", QueryType.INFLUX_QL);
        assertEquals(defaults, Options.queryOptions(defaults));
    }

    @Test
    void writeOptions_gzipThresholdOverrideKeepsPrecision() {
        var defaults = new WriteOptions("", WritePrecision.NANOSECOND, Map.of(), 1_000);

        var resolved = Options.writeOptions(defaults, Options.withGzipThreshold(0));

        assertEquals(0, resolved.gzipThreshold());
        assertEquals(WritePrecision.NANOSECOND, resolved.precision());
        assertEquals(1_000, defaults.gzipThreshold());
    }

    @Test
    void writeOptions_ignoresQueryDefaults() {
        var resolved = Options.resolve(null, WriteOptions.DEFAULTS, List.of(Options.withQueryType(QueryType.INFLUX_QL)));

        assertEquals(WriteOptions.DEFAULTS, resolved.write());
        assertEquals(QueryType.INFLUX_QL, resolved.query().queryType());
        assertEquals("", resolved.query().database());
    }

    @Test
    void resolve_withoutDefaultsStartsFromZeroValues() {
        var resolved = Options.resolve(null, null, List.of());

        assertEquals(new QueryOptions("", QueryType.FLIGHT_SQL, Map.of()), resolved.query());
        assertEquals(new WriteOptions("", WritePrecision.NANOSECOND, Map.of(), 0), resolved.write());
    }

    @Test
    void withDatabase_setsBothHalves() {
        var resolved = Options.resolve(QueryOptions.DEFAULTS, WriteOptions.DEFAULTS,
                List.of(Options.withDatabase("events")));

        assertEquals("events", resolved.query().database());
        assertEquals("events", resolved.write().database());
    }

    @Test
    void withDefaultTags_replacesConfiguredTags() {
        var defaults = new WriteOptions("", WritePrecision.MILLISECOND, Map.of("rack", "main"), 1_000);

        var resolved = Options.writeOptions(defaults, Options.withDefaultTags(Map.of("host", "a")));

        assertEquals(Map.of("host", "a"), resolved.defaultTags());
        assertEquals(WritePrecision.MILLISECOND, resolved.precision());
    }

    @Test
    void withDefaultTags_copiesTheGivenMap() {
        var tags = new HashMap<String, String>();
        tags.put("rack", "main");
        var option = Options.withDefaultTags(tags);
        tags.put("host", "b");

        var resolved = Options.writeOptions(WriteOptions.DEFAULTS, option);

        assertEquals(Map.of("rack", "main"), resolved.defaultTags());
    }

    @Test
    void withHeader_accumulatesOnTopOfDefaults() {
        var defaults = new QueryOptions("", QueryType.FLIGHT_SQL, Map.of("a", "1"));

        var resolved = Options.queryOptions(defaults, Options.withHeader("b", "2"), Options.withHeader("a", "3"));

        assertEquals(Map.of("a", "3", "b", "2"), resolved.headers());
    }

    @Test
    void resolvedOptionsAreImmutable() {
        var resolved = Options.writeOptions(WriteOptions.DEFAULTS, Options.withDefaultTags(Map.of("k", "v")));

        assertThrows(UnsupportedOperationException.class, () -> resolved.defaultTags().put("x", "y"));
    }

    @Test
    void resolve_rejectsNullOverride() {
        var overrides = new ArrayList<Option>();
        overrides.add(null);
        assertThrows(NullPointerException.class,
                () -> Options.resolve(QueryOptions.DEFAULTS, null, overrides));
    }

    @Test
    void withGzipThreshold_rejectsNegative() {
        assertThrows(IllegalArgumentException.class, () -> Options.withGzipThreshold(-1));
        assertThrows(IllegalArgumentException.class,
                () -> new WriteOptions("", WritePrecision.NANOSECOND, Map.of(), -1));
    }
}
