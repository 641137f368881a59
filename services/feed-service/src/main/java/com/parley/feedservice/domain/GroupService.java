package com.parley.feedservice.domain;

import com.parley.eventbus.TopicBus;
import com.parley.eventbus.routing.SubscriptionRouter;
import com.parley.feedmodel.Group;
import com.parley.feedmodel.MessageValidator;
import com.parley.feedmodel.ValidationResult;
import com.parley.feedservice.infrastructure.persistence.JdbcGroupRepository;
import com.parley.feedservice.infrastructure.persistence.JdbcUserRepository;
import com.parley.security.GroupAccessEnforcer;
import com.parley.security.Identity;
import com.parley.security.UnauthenticatedException;
import com.parley.security.UnauthorizedException;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Group lifecycle: create, rename, leave and delete.
 *
 * <p>Live subscriptions are authorized once, so leaving or deleting a group closes the
 * subscriptions that were authorized on the old membership.
 */
@Service
public class GroupService {

    private static final Logger log = LoggerFactory.getLogger(GroupService.class);

    private final JdbcGroupRepository groups;
    private final JdbcUserRepository users;
    private final GroupAccessEnforcer access;
    private final SubscriptionRouter router;
    private final TopicBus bus;
    private final Clock clock;

    public GroupService(
            JdbcGroupRepository groups,
            JdbcUserRepository users,
            GroupAccessEnforcer access,
            SubscriptionRouter router,
            TopicBus bus,
            Clock clock) {
        this.groups = groups;
        this.users = users;
        this.access = access;
        this.router = router;
        this.bus = bus;
        this.clock = clock;
    }

    /**
     * Creates a group containing the caller and the given users, and publishes it on
     * {@link FeedTopics#GROUP_ADDED}.
     *
     * @throws UnauthenticatedException if identity is null
     * @throws IllegalArgumentException if the name is invalid or a member is not a registered user
     */
    public Group create(Identity identity, String name, Collection<Long> memberIds) {
        if (identity == null) {
            throw new UnauthenticatedException();
        }
        ValidationResult validation = MessageValidator.validateNewGroup(name, identity.userId());
        if (!validation.valid()) {
            throw new IllegalArgumentException(validation.describe());
        }

        Set<Long> members = new LinkedHashSet<>();
        members.add(identity.userId());
        if (memberIds != null) {
            members.addAll(memberIds);
        }
        Set<Long> unknown = new TreeSet<>(members);
        unknown.removeAll(users.findExistingIds(members));
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown user(s): " + unknown);
        }

        Group group = groups.insert(name.strip(), identity.userId(), members, clock.instant());
        log.info("User {} created group {} with {} member(s)", identity.userId(), group.id(), members.size());
        bus.publish(FeedTopics.GROUP_ADDED, group);
        return group;
    }

    /**
     * Renames a group. Any member may rename it.
     *
     * @throws UnauthorizedException    if the caller is not a member
     * @throws IllegalArgumentException if the name is invalid
     */
    public Group rename(Identity identity, long groupId, String name) {
        if (identity == null) {
            throw new UnauthenticatedException();
        }
        ValidationResult validation = MessageValidator.validateNewGroup(name, identity.userId());
        if (!validation.valid()) {
            throw new IllegalArgumentException(validation.describe());
        }
        access.enforce(identity, groupId);

        groups.rename(groupId, name.strip());
        log.info("User {} renamed group {}", identity.userId(), groupId);
        return groups.findById(groupId)
                .orElseThrow(() -> new IllegalStateException("Group " + groupId + " vanished during rename"));
    }

    /**
     * Removes the caller from a group and closes their subscriptions that include it. The group is
     * deleted when its last member leaves.
     *
     * @throws UnauthorizedException if the caller is not a member
     */
    public void leave(Identity identity, long groupId) {
        access.enforce(identity, groupId);

        int remaining = groups.removeMember(groupId, identity.userId());
        int closed = router.closeWhere(s -> s.identity() != null
                && s.identity().userId() == identity.userId()
                && s.args().groupIds().contains(groupId));
        if (remaining == 0) {
            log.info("User {} left group {} as its last member; group deleted", identity.userId(), groupId);
        } else {
            log.info("User {} left group {} ({} subscription(s) closed)", identity.userId(), groupId, closed);
        }
    }

    /**
     * Deletes a group with its messages and closes every subscription that includes it. Only the
     * creator may delete a group.
     *
     * @throws UnauthorizedException if the caller is not a member or did not create the group
     */
    public void delete(Identity identity, long groupId) {
        access.enforce(identity, groupId);
        Group group = groups.findById(groupId)
                .orElseThrow(() -> new UnauthorizedException(identity.userId(), List.of(groupId)));
        if (group.creatorId() != identity.userId()) {
            throw new UnauthorizedException(identity.userId(), "did not create group " + groupId);
        }

        groups.delete(groupId);
        int closed = router.closeWhere(s -> s.args().groupIds().contains(groupId));
        log.info("User {} deleted group {} ({} subscription(s) closed)", identity.userId(), groupId, closed);
    }

    /** Groups the caller belongs to, oldest first. */
    public List<Group> groupsOf(Identity identity) {
        if (identity == null) {
            throw new UnauthenticatedException();
        }
        return groups.findByMember(identity.userId());
    }
}
