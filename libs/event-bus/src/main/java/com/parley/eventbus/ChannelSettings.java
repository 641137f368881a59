package com.parley.eventbus;

import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Buffering and delivery settings shared by every channel a {@link TopicBus} creates.
 *
 * @param capacity         events held per channel before the oldest is dropped
 * @param deliveryExecutor runs channel drainers; never the publisher's thread unless a direct
 *                         executor is supplied
 */
public record ChannelSettings(int capacity, Executor deliveryExecutor) {

    public static final int DEFAULT_CAPACITY = 256;

    public ChannelSettings {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, got " + capacity);
        }
        if (deliveryExecutor == null) {
            throw new IllegalArgumentException("deliveryExecutor must not be null");
        }
    }

    /** Default capacity, delivered on the common fork-join pool. */
    public static ChannelSettings defaults() {
        return new ChannelSettings(DEFAULT_CAPACITY, ForkJoinPool.commonPool());
    }
}
