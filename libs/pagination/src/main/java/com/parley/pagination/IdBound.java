package com.parley.pagination;

/**
 * Exclusive bound on record ids for a scan or existence check.
 *
 * @param kind  which side of the pivot is accepted
 * @param pivot the id the bound is relative to (ignored for {@link Kind#NONE})
 */
public record IdBound(Kind kind, long pivot) {

    /** Which side of the pivot a bound accepts. */
    public enum Kind {
        /** Every id. */
        NONE,
        /** Ids strictly smaller than the pivot (older records). */
        OLDER_THAN,
        /** Ids strictly greater than the pivot (newer records). */
        NEWER_THAN
    }

    private static final IdBound UNBOUNDED = new IdBound(Kind.NONE, 0);

    public IdBound {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
    }

    /** A bound accepting every id. */
    public static IdBound none() {
        return UNBOUNDED;
    }

    /** Accepts ids strictly smaller than {@code id}. */
    public static IdBound olderThan(long id) {
        return new IdBound(Kind.OLDER_THAN, id);
    }

    /** Accepts ids strictly greater than {@code id}. */
    public static IdBound newerThan(long id) {
        return new IdBound(Kind.NEWER_THAN, id);
    }

    /** Accepts ids less than or equal to {@code id}. */
    public static IdBound atMost(long id) {
        return id == Long.MAX_VALUE ? UNBOUNDED : olderThan(id + 1);
    }

    /** Accepts ids greater than or equal to {@code id}. */
    public static IdBound atLeast(long id) {
        return id == Long.MIN_VALUE ? UNBOUNDED : newerThan(id - 1);
    }

    /** Returns true if the id lies inside this bound. */
    public boolean accepts(long id) {
        return switch (kind) {
            case NONE -> true;
            case OLDER_THAN -> id < pivot;
            case NEWER_THAN -> id > pivot;
        };
    }
}
