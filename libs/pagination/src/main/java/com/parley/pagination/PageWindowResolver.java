package com.parley.pagination;

import com.parley.feedmodel.Sequenced;
import com.parley.observability.MetricFactory;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Turns a {@link WindowSpec} into a {@link Connection} over a {@link RecordSource}.
 *
 * <p>The feed is always returned newest first, so the directions are inverted relative to id
 * order:
 *
 * <ul>
 *   <li>forward ({@code first}/{@code after}): records with {@code id < decode(after)}, scanned
 *       newest first;
 *   <li>backward ({@code last}/{@code before}): records with {@code id > decode(before)}, scanned
 *       oldest first and then reversed.
 * </ul>
 *
 * <p>Boundary flags are lazy. The flag in the direction of travel is {@code false} without a
 * query when the page came back short, otherwise one existence check past the last edge. The
 * opposite flag is {@code false} without a cursor, otherwise one existence check on the far side of
 * the cursor. A cursor whose record was deleted still works as a numeric bound.
 *
 * <p>Cursors are decoded before the store is touched. Store failures surface as
 * {@link SourceUnavailableException} and are never retried here.
 *
 * @param <T> record type
 */
public final class PageWindowResolver<T extends Sequenced> {

    private static final Logger log = LoggerFactory.getLogger(PageWindowResolver.class);

    private final PaginationSettings settings;
    private final Timer forwardTimer;
    private final Timer backwardTimer;

    /** Creates a resolver with default page sizes and in-memory metrics. */
    public PageWindowResolver() {
        this(PaginationSettings.defaults(), MetricFactory.inMemory("parley-pagination"));
    }

    /**
     * Creates a resolver.
     *
     * @param settings page size limits
     * @param metrics  factory for the {@code feed.pagination.resolve} timer
     */
    public PageWindowResolver(PaginationSettings settings, MetricFactory metrics) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.settings = settings;
        this.forwardTimer = metrics.timer(
                "feed.pagination.resolve", "Time to resolve a page window", "direction", "forward");
        this.backwardTimer = metrics.timer(
                "feed.pagination.resolve", "Time to resolve a page window", "direction", "backward");
    }

    /**
     * Resolves one page of a container's feed.
     *
     * @param containerId the group whose records are paged
     * @param window      the requested window
     * @param source      ordered access to the container's records
     * @return the page, newest first, with lazily computed flags
     * @throws InvalidCursorException     if a supplied cursor is malformed
     * @throws SourceUnavailableException if the store fails
     */
    public Connection<T> resolve(long containerId, WindowSpec window, RecordSource<T> source) {
        if (window == null) {
            throw new IllegalArgumentException("window must not be null");
        }
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }

        // Both cursors are validated up front, even the one the window direction ignores.
        Long afterId = window.after() == null ? null : CursorCodec.decode(window.after());
        Long beforeId = window.before() == null ? null : CursorCodec.decode(window.before());

        boolean backward = window.isBackward();
        int limit = effectiveLimit(window.requestedCount());
        if (limit == 0) {
            return Connection.empty();
        }

        if (backward) {
            return backwardTimer.record(() -> backward(containerId, beforeId, limit, source));
        }
        return forwardTimer.record(() -> forward(containerId, afterId, limit, source));
    }

    /** Returns the page size limits in effect. */
    public PaginationSettings settings() {
        return settings;
    }

    private Connection<T> forward(long containerId, Long afterId, int limit, RecordSource<T> source) {
        IdBound bound = afterId == null ? IdBound.none() : IdBound.olderThan(afterId);
        List<T> records = scan(source, containerId, bound, ScanOrder.NEWEST_FIRST, limit);

        BooleanSupplier hasNext = () -> records.size() >= limit
                && exists(source, containerId, IdBound.olderThan(oldest(records)));
        BooleanSupplier hasPrevious = () -> afterId != null
                && exists(source, containerId, IdBound.atLeast(afterId));

        log.debug("Resolved forward window for container {} after {}: {} edge(s)",
                containerId, afterId, records.size());
        return new Connection<>(toEdges(records), PageInfo.lazy(hasNext, hasPrevious));
    }

    private Connection<T> backward(long containerId, Long beforeId, int limit, RecordSource<T> source) {
        IdBound bound = beforeId == null ? IdBound.none() : IdBound.newerThan(beforeId);
        List<T> records = new ArrayList<>(scan(source, containerId, bound, ScanOrder.OLDEST_FIRST, limit));
        Collections.reverse(records);

        BooleanSupplier hasPrevious = () -> records.size() >= limit
                && exists(source, containerId, IdBound.newerThan(newest(records)));
        BooleanSupplier hasNext = () -> beforeId != null
                && exists(source, containerId, IdBound.atMost(beforeId));

        log.debug("Resolved backward window for container {} before {}: {} edge(s)",
                containerId, beforeId, records.size());
        return new Connection<>(toEdges(records), PageInfo.lazy(hasNext, hasPrevious));
    }

    private int effectiveLimit(Integer requested) {
        int count = requested == null ? settings.defaultPageSize() : requested;
        return Math.min(count, settings.maxPageSize());
    }

    private List<T> scan(RecordSource<T> source, long containerId, IdBound bound, ScanOrder order, int limit) {
        List<T> records;
        try {
            records = source.scan(containerId, bound, order, limit);
        } catch (SourceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceUnavailableException("Scan of container " + containerId + " failed", e);
        }
        return records.size() > limit ? List.copyOf(records.subList(0, limit)) : List.copyOf(records);
    }

    private boolean exists(RecordSource<T> source, long containerId, IdBound bound) {
        try {
            return source.exists(containerId, bound);
        } catch (SourceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceUnavailableException("Existence check on container " + containerId + " failed", e);
        }
    }

    private List<Edge<T>> toEdges(List<T> records) {
        List<Edge<T>> edges = new ArrayList<>(records.size());
        for (T record : records) {
            edges.add(new Edge<>(CursorCodec.encode(record.id()), record));
        }
        return edges;
    }

    private static long oldest(List<? extends Sequenced> newestFirst) {
        return newestFirst.get(newestFirst.size() - 1).id();
    }

    private static long newest(List<? extends Sequenced> newestFirst) {
        return newestFirst.get(0).id();
    }
}
