package com.parley.eventbus;

/**
 * Receiving end of a {@link Channel}.
 * <p>
 * Calls for one channel never overlap. After {@link #onError} or {@link #onComplete} no further
 * call is made.
 *
 * @param <E> event type
 */
public interface EventSink<E> {

    void onEvent(E event);

    /** Terminal: the channel failed, e.g. because authorization was denied. */
    void onError(Throwable cause);

    /** Terminal: the channel was closed normally. */
    void onComplete();
}
