package com.parley.pagination.testing;

import com.parley.feedmodel.Sequenced;
import com.parley.pagination.IdBound;
import com.parley.pagination.RecordSource;
import com.parley.pagination.ScanOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.ToLongFunction;

/**
 * A {@link RecordSource} over in-memory maps, for tests.
 * <p>
 * Counts every scan and existence check so tests can assert how many store round-trips a page
 * costs, and can be switched into a failing mode.
 *
 * @param <T> record type
 */
public final class InMemoryRecordSource<T extends Sequenced> implements RecordSource<T> {

    private final ToLongFunction<T> containerOf;
    private final Map<Long, NavigableMap<Long, T>> containers = new ConcurrentHashMap<>();
    private final AtomicInteger scans = new AtomicInteger();
    private final AtomicInteger existsChecks = new AtomicInteger();
    private final AtomicReference<RuntimeException> failure = new AtomicReference<>();

    /**
     * @param containerOf extracts the container (group) id of a record
     */
    public InMemoryRecordSource(ToLongFunction<T> containerOf) {
        this.containerOf = containerOf;
    }

    /** Stores the given records. */
    @SafeVarargs
    public final InMemoryRecordSource<T> add(T... records) {
        for (T record : records) {
            containers.computeIfAbsent(containerOf.applyAsLong(record), id -> new ConcurrentSkipListMap<>())
                    .put(record.id(), record);
        }
        return this;
    }

    /** Removes a record, leaving a gap in the id sequence. */
    public void delete(long containerId, long id) {
        NavigableMap<Long, T> records = containers.get(containerId);
        if (records != null) {
            records.remove(id);
        }
    }

    /** Makes every subsequent call throw the given exception (null restores normal mode). */
    public void failWith(RuntimeException e) {
        failure.set(e);
    }

    public int scanCount() {
        return scans.get();
    }

    public int existsCount() {
        return existsChecks.get();
    }

    /** Total store round-trips so far. */
    public int callCount() {
        return scans.get() + existsChecks.get();
    }

    @Override
    public List<T> scan(long containerId, IdBound bound, ScanOrder order, int limit) {
        scans.incrementAndGet();
        checkAvailable();
        NavigableMap<Long, T> view = bounded(containerId, bound);
        if (order == ScanOrder.NEWEST_FIRST) {
            view = view.descendingMap();
        }
        List<T> result = new ArrayList<>(Math.min(limit, view.size()));
        for (T record : view.values()) {
            if (result.size() >= limit) {
                break;
            }
            result.add(record);
        }
        return result;
    }

    @Override
    public boolean exists(long containerId, IdBound bound) {
        existsChecks.incrementAndGet();
        checkAvailable();
        return !bounded(containerId, bound).isEmpty();
    }

    private NavigableMap<Long, T> bounded(long containerId, IdBound bound) {
        NavigableMap<Long, T> records = containers.getOrDefault(containerId, new ConcurrentSkipListMap<>());
        return switch (bound.kind()) {
            case NONE -> records;
            case OLDER_THAN -> records.headMap(bound.pivot(), false);
            case NEWER_THAN -> records.tailMap(bound.pivot(), false);
        };
    }

    private void checkAvailable() {
        RuntimeException e = failure.get();
        if (e != null) {
            throw e;
        }
    }
}
