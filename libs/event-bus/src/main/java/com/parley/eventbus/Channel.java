package com.parley.eventbus;

/**
 * One subscriber's delivery path on a topic.
 * <p>
 * {@link #offer} never blocks and never throws to the publisher; a closed channel simply refuses
 * the event.
 *
 * @param <E> event type
 */
public interface Channel<E> {

    String id();

    String topic();

    /**
     * Hands an event to the channel for asynchronous delivery.
     *
     * @return {@code false} if the channel is closed and the event was discarded
     */
    boolean offer(E event);

    /** Closes the channel, discarding undelivered events, and signals completion once. */
    void close();

    /** Closes the channel with an error, signalled once to the sink. */
    void fail(Throwable cause);

    boolean isOpen();

    /**
     * Registers a hook run synchronously when the channel closes, or immediately if it already has.
     */
    void whenClosed(Runnable hook);
}
