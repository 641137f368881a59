package com.parley.feedservice.domain;

import com.parley.eventbus.AuthCheck;
import com.parley.eventbus.routing.FilterArgs;
import com.parley.eventbus.routing.SubscriptionDefinition;
import com.parley.feedmodel.Message;
import com.parley.security.GroupAccessChecker;
import com.parley.security.Identity;
import org.springframework.stereotype.Component;

/**
 * {@code messageAdded}: new messages in the requested groups.
 *
 * <p>The subscriber must belong to every requested group (an empty list is denied). Each message
 * is delivered only if it was posted to one of those groups by someone else.
 */
@Component
public class MessageAddedSubscription implements SubscriptionDefinition<Message> {

    public static final String NAME = "messageAdded";

    private final GroupAccessChecker access;

    public MessageAddedSubscription(GroupAccessChecker access) {
        this.access = access;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String topic() {
        return FeedTopics.MESSAGE_ADDED;
    }

    @Override
    public Class<Message> eventType() {
        return Message.class;
    }

    @Override
    public AuthCheck authCheck(FilterArgs args, Identity identity) {
        return AuthCheck.fromAccessCheck(() -> access.checkCanAccessAll(identity, args.groupIds()));
    }

    @Override
    public boolean accepts(Message message, FilterArgs args, Identity identity) {
        return args.groupIds().contains(message.groupId()) && message.authorId() != identity.userId();
    }
}
