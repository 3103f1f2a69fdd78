package io.quiver.sql.common.options;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Timestamp precision of written points.
 */
public enum WritePrecision {
    NANOSECOND("ns", TimeUnit.NANOSECONDS),
    MICROSECOND("us", TimeUnit.MICROSECONDS),
    MILLISECOND("ms", TimeUnit.MILLISECONDS),
    SECOND("s", TimeUnit.SECONDS);

    private final String shortName;
    private final TimeUnit timeUnit;

    WritePrecision(String shortName, TimeUnit timeUnit) {
        this.shortName = shortName;
        this.timeUnit = timeUnit;
    }

    /** Name used on the wire, e.g. {@code ms}. */
    public String shortName() {
        return shortName;
    }

    public TimeUnit timeUnit() {
        return timeUnit;
    }

    /**
     * Accepts the wire name ({@code ns}, {@code us}, {@code ms}, {@code s}) or the enum name,
     * case-insensitive.
     */
    public static WritePrecision fromString(String value) {
        var trimmed = value.trim();
        for (WritePrecision p : values()) {
            if (p.shortName.equalsIgnoreCase(trimmed) || p.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown write precision: " + value);
    }
}
