package com.parley.pagination;

import java.util.List;

/**
 * One page of a newest-first feed.
 *
 * @param edges    records of the page, newest first
 * @param pageInfo lazily computed boundary flags
 * @param <T>      record type
 */
public record Connection<T>(List<Edge<T>> edges, PageInfo pageInfo) {

    public Connection {
        edges = List.copyOf(edges);
    }

    /** An empty page with both flags false. */
    public static <T> Connection<T> empty() {
        return new Connection<>(List.of(), PageInfo.of(false, false));
    }

    /** The records of this page, newest first. */
    public List<T> nodes() {
        return edges.stream().map(Edge::node).toList();
    }
}
