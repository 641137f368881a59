package com.parley.feedservice.api;

import com.parley.feedmodel.Message;
import com.parley.pagination.Connection;
import com.parley.pagination.Edge;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A page of messages as sent over HTTP. {@code pageInfo} carries only the flags the client asked
 * for, so an unrequested flag never costs a store query.
 *
 * @param edges    messages of the page, newest first
 * @param pageInfo the selected boundary flags
 */
public record MessagePage(List<Edge<Message>> edges, Map<String, Boolean> pageInfo) {

    static final String HAS_NEXT_PAGE = "hasNextPage";
    static final String HAS_PREVIOUS_PAGE = "hasPreviousPage";
    static final Set<String> ALL_FLAGS = Set.of(HAS_NEXT_PAGE, HAS_PREVIOUS_PAGE);

    /**
     * Resolves the selected flags of {@code page}. A store failure while resolving surfaces here,
     * before anything is written to the response.
     *
     * @throws IllegalArgumentException if a selected flag name is unknown
     */
    static MessagePage of(Connection<Message> page, Collection<String> flags) {
        for (String flag : flags) {
            if (!ALL_FLAGS.contains(flag)) {
                throw new IllegalArgumentException("Unknown pageInfo flag '" + flag + "'; expected one of "
                        + List.of(HAS_NEXT_PAGE, HAS_PREVIOUS_PAGE));
            }
        }
        Map<String, Boolean> info = new LinkedHashMap<>();
        if (flags.contains(HAS_NEXT_PAGE)) {
            info.put(HAS_NEXT_PAGE, page.pageInfo().hasNextPage());
        }
        if (flags.contains(HAS_PREVIOUS_PAGE)) {
            info.put(HAS_PREVIOUS_PAGE, page.pageInfo().hasPreviousPage());
        }
        return new MessagePage(page.edges(), info);
    }
}
