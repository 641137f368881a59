package com.parley.pagination;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.function.BooleanSupplier;

/**
 * Boundary flags of a page.
 * <p>
 * Each flag may cost a store round-trip, so it is computed only when first read and then
 * memoized. Reading a flag can therefore throw {@link SourceUnavailableException}.
 */
public final class PageInfo {

    private final LazyFlag hasNextPage;
    private final LazyFlag hasPreviousPage;

    PageInfo(LazyFlag hasNextPage, LazyFlag hasPreviousPage) {
        this.hasNextPage = hasNextPage;
        this.hasPreviousPage = hasPreviousPage;
    }

    /**
     * Creates page info whose flags are evaluated on demand.
     *
     * @param hasNextPage     computes whether older records exist beyond the page
     * @param hasPreviousPage computes whether newer records exist beyond the page
     */
    public static PageInfo lazy(BooleanSupplier hasNextPage, BooleanSupplier hasPreviousPage) {
        return new PageInfo(new LazyFlag(hasNextPage), new LazyFlag(hasPreviousPage));
    }

    /** Creates page info with precomputed flags. */
    public static PageInfo of(boolean hasNextPage, boolean hasPreviousPage) {
        return new PageInfo(LazyFlag.constant(hasNextPage), LazyFlag.constant(hasPreviousPage));
    }

    /** True if records older than the last edge exist. */
    @JsonProperty("hasNextPage")
    public boolean hasNextPage() {
        return hasNextPage.get();
    }

    /** True if records newer than the first edge exist. */
    @JsonProperty("hasPreviousPage")
    public boolean hasPreviousPage() {
        return hasPreviousPage.get();
    }

    /** Returns true once {@link #hasNextPage()} has been computed. */
    @JsonIgnore
    public boolean isNextPageResolved() {
        return hasNextPage.isEvaluated();
    }

    /** Returns true once {@link #hasPreviousPage()} has been computed. */
    @JsonIgnore
    public boolean isPreviousPageResolved() {
        return hasPreviousPage.isEvaluated();
    }

    @Override
    public String toString() {
        return "PageInfo[hasNextPage=" + describe(hasNextPage)
                + ", hasPreviousPage=" + describe(hasPreviousPage) + "]";
    }

    private static String describe(LazyFlag flag) {
        return flag.isEvaluated() ? String.valueOf(flag.get()) : "<unresolved>";
    }
}
