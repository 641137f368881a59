package com.parley.pagination;

/**
 * A record paired with the cursor that points at it.
 *
 * @param cursor opaque position of {@code node} in the feed
 * @param node   the record
 * @param <T>    record type
 */
public record Edge<T>(String cursor, T node) {}
