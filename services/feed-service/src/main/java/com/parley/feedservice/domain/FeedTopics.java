package com.parley.feedservice.domain;

/** Topic names on the service's {@code TopicBus}. */
public final class FeedTopics {

    /** Carries every newly stored {@code Message}. */
    public static final String MESSAGE_ADDED = "MESSAGE_ADDED";

    /** Carries every newly created {@code Group}. */
    public static final String GROUP_ADDED = "GROUP_ADDED";

    private FeedTopics() {
        // utility class
    }
}
