package com.parley.feedmodel;

import java.time.Instant;

/**
 * A chat message: the immutable unit of the feed.
 *
 * <p>Messages are never edited after creation. The {@code text} is opaque to the pagination and
 * subscription machinery; only {@code id}, {@code groupId} and {@code authorId} are ever inspected.
 *
 * @param id        store-assigned identifier, strictly increasing and never reused
 * @param groupId   the group (conversation) the message was sent to
 * @param authorId  user who sent the message
 * @param text      message body
 * @param createdAt when the store accepted the message
 */
public record Message(long id, long groupId, long authorId, String text, Instant createdAt)
        implements Sequenced {}
