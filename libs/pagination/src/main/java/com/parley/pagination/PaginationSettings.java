package com.parley.pagination;

/**
 * Page size limits applied by {@link PageWindowResolver}.
 *
 * @param defaultPageSize size used when a window names no count
 * @param maxPageSize     upper bound; larger requested counts are clamped to it
 */
public record PaginationSettings(int defaultPageSize, int maxPageSize) {

    /** Default page size when none is configured. */
    public static final int DEFAULT_PAGE_SIZE = 20;

    /** Maximum page size when none is configured. */
    public static final int DEFAULT_MAX_PAGE_SIZE = 100;

    public PaginationSettings {
        if (maxPageSize <= 0) {
            throw new IllegalArgumentException("maxPageSize must be positive");
        }
        if (defaultPageSize <= 0 || defaultPageSize > maxPageSize) {
            throw new IllegalArgumentException("defaultPageSize must be between 1 and maxPageSize");
        }
    }

    public static PaginationSettings defaults() {
        return new PaginationSettings(DEFAULT_PAGE_SIZE, DEFAULT_MAX_PAGE_SIZE);
    }
}
