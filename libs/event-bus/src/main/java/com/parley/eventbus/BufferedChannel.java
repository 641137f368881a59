package com.parley.eventbus;

import com.parley.observability.CorrelationContext;
import com.parley.observability.CorrelationContextHolder;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A {@link Channel} with a bounded in-memory buffer and a single drainer.
 *
 * <p>{@link #offer} enqueues under the channel monitor and, if no drainer is scheduled, submits one
 * to the delivery executor. The publisher never runs the sink. When the buffer is full the oldest
 * event is dropped and counted.
 *
 * <p>A channel created suspended buffers without delivering until {@link #resume()}; this is how a
 * {@link GatedChannel} holds events while authorization is pending.
 *
 * <p>Exactly one terminal signal reaches the sink. If a drainer is mid-delivery when the channel
 * closes, the drainer emits the terminal signal after its current event so sink calls never overlap.
 *
 * @param <E> event type
 */
public final class BufferedChannel<E> implements Channel<E> {

    private static final Logger log = LoggerFactory.getLogger(BufferedChannel.class);

    private final String id;
    private final String topic;
    private final EventSink<? super E> sink;
    private final ChannelSettings settings;
    private final CorrelationContext context;
    private final Counter droppedCounter;
    private final Counter failureCounter;

    // guarded by this
    private final ArrayDeque<E> buffer;
    private boolean suspended;
    private boolean draining;
    private boolean closed;
    private Throwable terminalCause;

    private final AtomicBoolean terminalEmitted = new AtomicBoolean();
    private final AtomicLong dropped = new AtomicLong();
    private final List<Runnable> closeHooks = new CopyOnWriteArrayList<>();

    /**
     * @param id             channel id, also the subscription id when routed
     * @param topic          topic the channel is registered on
     * @param sink           receiver of events and the terminal signal
     * @param settings       capacity and delivery executor
     * @param suspended      whether delivery waits for {@link #resume()}
     * @param context        correlation context installed around each sink call, nullable
     * @param droppedCounter incremented per overflow drop, nullable
     * @param failureCounter incremented per sink failure, nullable
     */
    public BufferedChannel(String id, String topic, EventSink<? super E> sink, ChannelSettings settings,
                           boolean suspended, CorrelationContext context,
                           Counter droppedCounter, Counter failureCounter) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be null or blank");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink must not be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        this.id = id;
        this.topic = topic;
        this.sink = sink;
        this.settings = settings;
        this.suspended = suspended;
        this.context = context;
        this.droppedCounter = droppedCounter;
        this.failureCounter = failureCounter;
        this.buffer = new ArrayDeque<>(Math.min(settings.capacity(), 64));
    }

    /** Creates an unsuspended channel without metrics or correlation context. */
    public BufferedChannel(String id, String topic, EventSink<? super E> sink, ChannelSettings settings) {
        this(id, topic, sink, settings, false, null, null, null);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String topic() {
        return topic;
    }

    @Override
    public boolean offer(E event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        boolean schedule;
        synchronized (this) {
            if (closed) {
                return false;
            }
            if (buffer.size() >= settings.capacity()) {
                buffer.pollFirst();
                recordDrop();
            }
            buffer.addLast(event);
            schedule = !suspended && !draining;
            if (schedule) {
                draining = true;
            }
        }
        if (schedule) {
            scheduleDrain();
        }
        return true;
    }

    /** Starts delivery of buffered and future events. No effect unless suspended and open. */
    public void resume() {
        boolean schedule;
        synchronized (this) {
            if (closed || !suspended) {
                return;
            }
            suspended = false;
            schedule = !draining && !buffer.isEmpty();
            if (schedule) {
                draining = true;
            }
        }
        if (schedule) {
            scheduleDrain();
        }
    }

    @Override
    public void close() {
        terminate(null);
    }

    @Override
    public void fail(Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause must not be null");
        }
        terminate(cause);
    }

    @Override
    public synchronized boolean isOpen() {
        return !closed;
    }

    @Override
    public void whenClosed(Runnable hook) {
        if (hook == null) {
            throw new IllegalArgumentException("hook must not be null");
        }
        closeHooks.add(hook);
        boolean alreadyClosed;
        synchronized (this) {
            alreadyClosed = closed;
        }
        if (alreadyClosed && closeHooks.remove(hook)) {
            hook.run();
        }
    }

    public synchronized boolean isSuspended() {
        return suspended;
    }

    /** Events currently buffered and not yet handed to the sink. */
    public synchronized int buffered() {
        return buffer.size();
    }

    /** Events discarded because the buffer was full. */
    public long droppedCount() {
        return dropped.get();
    }

    private void terminate(Throwable cause) {
        boolean emitNow;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            terminalCause = cause;
            buffer.clear();
            emitNow = !draining;
            draining = true;
        }
        if (emitNow) {
            emitTerminal();
        }
        runCloseHooks();
    }

    private void scheduleDrain() {
        try {
            settings.deliveryExecutor().execute(this::drain);
        } catch (RejectedExecutionException e) {
            log.warn("Delivery executor rejected drainer for channel {} on topic {}", id, topic, e);
            synchronized (this) {
                draining = false;
            }
            fail(e);
        }
    }

    private void drain() {
        while (true) {
            E next;
            synchronized (this) {
                if (closed) {
                    break;
                }
                if (suspended || buffer.isEmpty()) {
                    draining = false;
                    return;
                }
                next = buffer.pollFirst();
            }
            deliver(next);
        }
        emitTerminal();
    }

    private void deliver(E event) {
        withContext(() -> {
            try {
                sink.onEvent(event);
            } catch (RuntimeException e) {
                if (failureCounter != null) {
                    failureCounter.increment();
                }
                log.warn("Sink of channel {} on topic {} failed to handle an event", id, topic, e);
            }
        });
    }

    private void emitTerminal() {
        if (!terminalEmitted.compareAndSet(false, true)) {
            return;
        }
        Throwable cause;
        synchronized (this) {
            cause = terminalCause;
        }
        withContext(() -> {
            try {
                if (cause == null) {
                    sink.onComplete();
                } else {
                    sink.onError(cause);
                }
            } catch (RuntimeException e) {
                log.warn("Sink of channel {} on topic {} failed to handle its terminal signal", id, topic, e);
            }
        });
    }

    private void runCloseHooks() {
        for (Runnable hook : closeHooks) {
            if (!closeHooks.remove(hook)) {
                continue;
            }
            try {
                hook.run();
            } catch (RuntimeException e) {
                log.warn("Close hook of channel {} failed", id, e);
            }
        }
    }

    private void recordDrop() {
        long total = dropped.incrementAndGet();
        if (droppedCounter != null) {
            droppedCounter.increment();
        }
        if (total == 1) {
            log.warn("Channel {} on topic {} is full ({} events); dropping oldest", id, topic, settings.capacity());
        } else {
            log.debug("Channel {} on topic {} dropped event #{}", id, topic, total);
        }
    }

    private void withContext(Runnable work) {
        if (context == null) {
            work.run();
        } else {
            CorrelationContextHolder.runWithContext(context, work);
        }
    }

    @Override
    public String toString() {
        return "BufferedChannel[id=" + id + ", topic=" + topic + "]";
    }
}
