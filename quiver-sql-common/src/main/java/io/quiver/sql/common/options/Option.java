package io.quiver.sql.common.options;

/**
 * Override of a single option, passed to the query and write methods of the client.
 * <p>
 * Query methods honour {@link Options#withDatabase}, {@link Options#withQueryType} and
 * {@link Options#withHeader}; write resolution honours {@link Options#withDatabase},
 * {@link Options#withPrecision}, {@link Options#withGzipThreshold} and {@link Options#withDefaultTags}.
 */
@FunctionalInterface
public interface Option {

    void apply(Options.Draft draft);
}
