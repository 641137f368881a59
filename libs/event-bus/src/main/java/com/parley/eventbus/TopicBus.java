package com.parley.eventbus;

import com.parley.observability.CorrelationContext;
import com.parley.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process publish/subscribe registry keyed by topic name.
 *
 * <p>{@link #publish} fans an event out to a snapshot of the channels registered at call time.
 * Each channel only enqueues, so a slow subscriber never holds up the publisher or its peers.
 * Publishes to the same topic are serialized, which gives every subscriber the same order.
 *
 * <p>Delivery is at-most-once and best-effort: a channel that is full drops its oldest event, and
 * a channel that misbehaves is logged and counted without affecting the others. Closing a channel
 * removes it from its topic before {@code close()} returns.
 *
 * <p>An instance is shared by the whole process and is safe for concurrent use.
 */
public final class TopicBus {

    private static final Logger log = LoggerFactory.getLogger(TopicBus.class);

    private final ConcurrentHashMap<String, Topic> topics = new ConcurrentHashMap<>();
    private final ChannelSettings settings;
    private final MetricFactory metrics;

    public TopicBus() {
        this(ChannelSettings.defaults(), MetricFactory.inMemory("parley-event-bus"));
    }

    public TopicBus(ChannelSettings settings, MetricFactory metrics) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.settings = settings;
        this.metrics = metrics;
    }

    /**
     * Delivers {@code event} to every channel currently registered on {@code topic}.
     * Publishing to a topic with no subscribers is a no-op.
     */
    public void publish(String topic, Object event) {
        requireTopic(topic);
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        Topic t = topics.get(topic);
        if (t == null) {
            return;
        }
        t.lock.lock();
        try {
            t.published.increment();
            for (Channel<Object> channel : t.channels) {
                try {
                    channel.offer(event);
                } catch (RuntimeException e) {
                    t.failures.increment();
                    log.warn("Delivery to channel {} on topic {} failed", channel.id(), topic, e);
                }
            }
        } finally {
            t.lock.unlock();
        }
    }

    /** Creates an unsuspended channel for {@code sink} and registers it on {@code topic}. */
    public Channel<Object> subscribe(String topic, EventSink<Object> sink) {
        return register(topic, newChannel(topic, UUID.randomUUID().toString(), sink, false, null));
    }

    /**
     * Creates a channel with this bus's settings and meters without registering it.
     *
     * @param suspended whether delivery waits for {@link BufferedChannel#resume()}
     * @param context   correlation context for the delivery thread, nullable
     */
    public BufferedChannel<Object> newChannel(String topic, String id, EventSink<Object> sink,
                                              boolean suspended, CorrelationContext context) {
        requireTopic(topic);
        Topic t = topic(topic);
        return new BufferedChannel<>(id, topic, sink, settings, suspended, context, t.dropped, t.failures);
    }

    /**
     * Registers an externally built channel. The channel is removed from the topic when it closes.
     *
     * @throws IllegalStateException if the channel is already closed
     */
    public <C extends Channel<Object>> C register(String topic, C channel) {
        requireTopic(topic);
        if (channel == null) {
            throw new IllegalArgumentException("channel must not be null");
        }
        if (!channel.isOpen()) {
            throw new IllegalStateException("Cannot register closed channel " + channel.id());
        }
        topic(topic).channels.add(channel);
        channel.whenClosed(() -> remove(topic, channel));
        log.debug("Registered channel {} on topic {}", channel.id(), topic);
        return channel;
    }

    /**
     * Removes the channel from the topic and closes it.
     *
     * @return {@code true} if the channel was registered on the topic
     */
    public boolean unsubscribe(String topic, Channel<?> channel) {
        boolean removed = remove(topic, channel);
        if (removed) {
            channel.close();
        }
        return removed;
    }

    public int subscriberCount(String topic) {
        Topic t = topics.get(topic);
        return t == null ? 0 : t.channels.size();
    }

    /** Names of every topic that has ever had a subscriber. */
    public Set<String> topics() {
        return Set.copyOf(topics.keySet());
    }

    public ChannelSettings settings() {
        return settings;
    }

    private boolean remove(String topic, Channel<?> channel) {
        Topic t = topics.get(topic);
        if (t == null || !t.channels.remove(channel)) {
            return false;
        }
        log.debug("Removed channel {} from topic {}", channel.id(), topic);
        return true;
    }

    private Topic topic(String name) {
        return topics.computeIfAbsent(name, this::createTopic);
    }

    private Topic createTopic(String name) {
        metrics.gauge("feed.bus.subscribers", "Channels registered on a topic",
                () -> subscriberCount(name), "topic", name);
        return new Topic(
                metrics.counter("feed.bus.published", "Events published", "topic", name),
                metrics.counter("feed.bus.delivery.failures", "Deliveries that failed", "topic", name),
                metrics.counter("feed.bus.dropped", "Events dropped by full channels", "topic", name));
    }

    private static void requireTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be null or blank");
        }
    }

    private static final class Topic {
        final List<Channel<Object>> channels = new CopyOnWriteArrayList<>();
        final ReentrantLock lock = new ReentrantLock();
        final Counter published;
        final Counter failures;
        final Counter dropped;

        Topic(Counter published, Counter failures, Counter dropped) {
            this.published = published;
            this.failures = failures;
            this.dropped = dropped;
        }
    }
}
