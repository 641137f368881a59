package com.parley.feedservice.domain;

import com.parley.eventbus.TopicBus;
import com.parley.feedmodel.Message;
import com.parley.feedmodel.MessageValidator;
import com.parley.feedmodel.ValidationResult;
import com.parley.feedservice.infrastructure.persistence.JdbcMessageStore;
import com.parley.pagination.Connection;
import com.parley.pagination.PageWindowResolver;
import com.parley.pagination.WindowSpec;
import com.parley.security.GroupAccessEnforcer;
import com.parley.security.Identity;
import com.parley.security.UnauthenticatedException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reads and writes a group's messages. Every operation requires the caller to be a member.
 */
@Service
public class MessageService {

    private static final Logger log = LoggerFactory.getLogger(MessageService.class);

    private final JdbcMessageStore store;
    private final GroupAccessEnforcer access;
    private final PageWindowResolver<Message> resolver;
    private final TopicBus bus;
    private final Clock clock;

    public MessageService(
            JdbcMessageStore store,
            GroupAccessEnforcer access,
            PageWindowResolver<Message> resolver,
            TopicBus bus,
            Clock clock) {
        this.store = store;
        this.access = access;
        this.resolver = resolver;
        this.bus = bus;
        this.clock = clock;
    }

    /**
     * Returns one page of the group's history, newest first.
     *
     * @throws UnauthenticatedException if identity is null
     * @throws com.parley.security.UnauthorizedException if the caller is not a member
     * @throws com.parley.pagination.InvalidCursorException if a cursor is malformed
     * @throws com.parley.pagination.SourceUnavailableException if the store fails
     */
    public Connection<Message> page(Identity identity, long groupId, WindowSpec window) {
        access.enforce(identity, groupId);
        return resolver.resolve(groupId, window, store);
    }

    /**
     * Stores a message and publishes it on {@link FeedTopics#MESSAGE_ADDED}.
     *
     * @throws IllegalArgumentException if the text is missing or too long
     */
    public Message post(Identity identity, long groupId, String text) {
        if (identity == null) {
            throw new UnauthenticatedException();
        }
        ValidationResult validation = MessageValidator.validateNewMessage(groupId, identity.userId(), text);
        if (!validation.valid()) {
            throw new IllegalArgumentException(validation.describe());
        }
        access.enforce(identity, groupId);

        Message message = store.insert(groupId, identity.userId(), text, clock.instant());
        log.info("User {} posted message {} to group {}", identity.userId(), message.id(), groupId);
        bus.publish(FeedTopics.MESSAGE_ADDED, message);
        return message;
    }
}
