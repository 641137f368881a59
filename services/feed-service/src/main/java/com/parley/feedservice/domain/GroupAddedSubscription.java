package com.parley.feedservice.domain;

import com.parley.eventbus.AuthCheck;
import com.parley.eventbus.routing.FilterArgs;
import com.parley.eventbus.routing.SubscriptionDefinition;
import com.parley.feedmodel.Group;
import com.parley.security.Identity;
import com.parley.security.UnauthorizedException;
import org.springframework.stereotype.Component;

/**
 * {@code groupAdded}: groups the subscriber has just been added to by someone else.
 *
 * <p>A {@code userId} argument, when given, must name the subscriber.
 */
@Component
public class GroupAddedSubscription implements SubscriptionDefinition<Group> {

    public static final String NAME = "groupAdded";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String topic() {
        return FeedTopics.GROUP_ADDED;
    }

    @Override
    public Class<Group> eventType() {
        return Group.class;
    }

    @Override
    public AuthCheck authCheck(FilterArgs args, Identity identity) {
        if (args.userId() != null && args.userId() != identity.userId()) {
            return AuthCheck.denyWith(new UnauthorizedException(
                    identity.userId(), "cannot follow groups of user " + args.userId()));
        }
        return AuthCheck.allowAll();
    }

    @Override
    public boolean accepts(Group group, FilterArgs args, Identity identity) {
        return group.hasMember(identity.userId()) && group.creatorId() != identity.userId();
    }
}
