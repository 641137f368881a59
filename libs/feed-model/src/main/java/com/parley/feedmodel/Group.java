package com.parley.feedmodel;

import java.time.Instant;
import java.util.Set;

/**
 * A group conversation and its members.
 *
 * @param id        store-assigned identifier
 * @param name      display name
 * @param creatorId user who created the group
 * @param memberIds users belonging to the group, the creator included
 * @param createdAt when the group was created
 */
public record Group(long id, String name, long creatorId, Set<Long> memberIds, Instant createdAt) {

    /** Compact constructor: freezes the member set. */
    public Group {
        memberIds = memberIds == null ? Set.of() : Set.copyOf(memberIds);
    }

    /** Returns true if the given user belongs to this group. */
    public boolean hasMember(long userId) {
        return memberIds.contains(userId);
    }
}
