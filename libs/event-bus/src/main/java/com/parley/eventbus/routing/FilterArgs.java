package com.parley.eventbus.routing;

import java.util.Collection;
import java.util.List;

/**
 * Typed subscription arguments, already parsed by the transport.
 *
 * @param groupIds groups the subscriber asked to follow; empty when not applicable
 * @param userId   user the subscription is scoped to, nullable
 */
public record FilterArgs(List<Long> groupIds, Long userId) {

    public FilterArgs {
        groupIds = groupIds == null ? List.of() : List.copyOf(groupIds);
    }

    public static FilterArgs none() {
        return new FilterArgs(List.of(), null);
    }

    public static FilterArgs forGroups(Collection<Long> groupIds) {
        return new FilterArgs(groupIds == null ? List.of() : List.copyOf(groupIds), null);
    }

    public static FilterArgs forUser(Long userId) {
        return new FilterArgs(List.of(), userId);
    }
}
