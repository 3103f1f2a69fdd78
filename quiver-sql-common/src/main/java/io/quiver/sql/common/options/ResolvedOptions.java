package io.quiver.sql.common.options;

/**
 * Both halves of a resolution. Callers normally keep only the half they asked for.
 */
public record ResolvedOptions(QueryOptions query, WriteOptions write) {
}
