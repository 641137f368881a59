package com.parley.pagination;

/** Order in which a {@link RecordSource} returns records. */
public enum ScanOrder {
    /** Descending id. */
    NEWEST_FIRST,
    /** Ascending id. */
    OLDEST_FIRST
}
