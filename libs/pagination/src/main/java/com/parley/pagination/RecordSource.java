package com.parley.pagination;

import com.parley.feedmodel.Sequenced;

import java.util.List;

/**
 * Ordered, bounded access to the records of one container (group).
 * <p>
 * This is the only thing the pagination engine needs from the store. Implementations signal
 * store failures with {@link SourceUnavailableException}.
 *
 * @param <T> record type
 */
public interface RecordSource<T extends Sequenced> {

    /**
     * Returns up to {@code limit} records of the container that satisfy the bound, in the given
     * order.
     *
     * @throws SourceUnavailableException if the store cannot be read
     */
    List<T> scan(long containerId, IdBound bound, ScanOrder order, int limit);

    /**
     * Returns true if at least one record of the container satisfies the bound.
     *
     * @throws SourceUnavailableException if the store cannot be read
     */
    boolean exists(long containerId, IdBound bound);
}
