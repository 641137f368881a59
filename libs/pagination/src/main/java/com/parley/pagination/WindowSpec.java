package com.parley.pagination;

/**
 * Which slice of a newest-first feed to return.
 * <p>
 * Forward windows ({@code first}/{@code after}) walk toward older records; backward windows
 * ({@code last}/{@code before}) walk toward newer ones. When both counts are supplied the window is
 * backward. A lone {@code before} with no counts is also backward. Anything else is forward.
 *
 * @param first  forward page size, or null
 * @param after  cursor to continue after (older side), or null
 * @param last   backward page size, or null
 * @param before cursor to continue before (newer side), or null
 */
public record WindowSpec(Integer first, String after, Integer last, String before) {

    public WindowSpec {
        if (first != null && first < 0) {
            throw new IllegalArgumentException("first must not be negative");
        }
        if (last != null && last < 0) {
            throw new IllegalArgumentException("last must not be negative");
        }
    }

    /** A forward window of {@code first} records older than {@code after}. */
    public static WindowSpec forward(int first, String after) {
        return new WindowSpec(first, after, null, null);
    }

    /** The newest {@code first} records. */
    public static WindowSpec first(int first) {
        return forward(first, null);
    }

    /** A backward window of {@code last} records newer than {@code before}. */
    public static WindowSpec backward(int last, String before) {
        return new WindowSpec(null, null, last, before);
    }

    /** Returns true if this window walks toward newer records. */
    public boolean isBackward() {
        if (last != null) {
            return true;
        }
        return first == null && before != null && after == null;
    }

    /** The count for this window's direction, or null if the caller left it unspecified. */
    public Integer requestedCount() {
        return isBackward() ? last : first;
    }
}
