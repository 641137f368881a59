package com.parley.feedservice.infrastructure.persistence;

import com.parley.feedmodel.Group;
import com.parley.security.MembershipDirectory;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Groups and their memberships.
 *
 * <p>Also the service's {@link MembershipDirectory}: membership lookups for subscription
 * authorization run on a dedicated executor so they never block a request or delivery thread.
 */
@Repository
public class JdbcGroupRepository implements MembershipDirectory {

    private final JdbcTemplate jdbc;
    private final NamedParameterJdbcTemplate named;
    private final Executor lookupExecutor;
    private final SimpleJdbcInsert insertGroup;

    public JdbcGroupRepository(
            JdbcTemplate jdbc,
            NamedParameterJdbcTemplate named,
            @Qualifier("membershipLookupExecutor") Executor lookupExecutor) {
        this.jdbc = jdbc;
        this.named = named;
        this.lookupExecutor = lookupExecutor;
        this.insertGroup = new SimpleJdbcInsert(jdbc)
                .withTableName("chat_groups")
                .usingColumns("name", "creator_id", "created_at")
                .usingGeneratedKeyColumns("id");
    }

    @Override
    public CompletableFuture<Set<Long>> groupsOf(long userId) {
        return CompletableFuture.supplyAsync(() -> findGroupIds(userId), lookupExecutor);
    }

    public Set<Long> findGroupIds(long userId) {
        return new HashSet<>(jdbc.queryForList(
                "SELECT group_id FROM group_members WHERE user_id = ?", Long.class, userId));
    }

    /** Creates a group with the given members in one transaction. */
    @Transactional
    public Group insert(String name, long creatorId, Set<Long> memberIds, Instant createdAt) {
        long id = insertGroup.executeAndReturnKey(Map.of(
                        "name", name,
                        "creator_id", creatorId,
                        "created_at", OffsetDateTime.ofInstant(createdAt, ZoneOffset.UTC)))
                .longValue();
        List<Object[]> rows = memberIds.stream().map(userId -> new Object[] {id, userId}).toList();
        jdbc.batchUpdate("INSERT INTO group_members (group_id, user_id) VALUES (?, ?)", rows);
        return new Group(id, name, creatorId, memberIds, createdAt);
    }

    /** Renames a group. Returns false if the group does not exist. */
    @Transactional
    public boolean rename(long groupId, String name) {
        return jdbc.update("UPDATE chat_groups SET name = ? WHERE id = ?", name, groupId) > 0;
    }

    /**
     * Removes a member. When the last member leaves, the group and its messages are deleted in
     * the same transaction.
     *
     * @return the number of members left
     */
    @Transactional
    public int removeMember(long groupId, long userId) {
        jdbc.update("DELETE FROM group_members WHERE group_id = ? AND user_id = ?", groupId, userId);
        Integer remaining = jdbc.queryForObject(
                "SELECT COUNT(*) FROM group_members WHERE group_id = ?", Integer.class, groupId);
        int left = remaining == null ? 0 : remaining;
        if (left == 0) {
            delete(groupId);
        }
        return left;
    }

    /** Deletes a group with its memberships and messages. Returns false if it did not exist. */
    @Transactional
    public boolean delete(long groupId) {
        jdbc.update("DELETE FROM messages WHERE group_id = ?", groupId);
        jdbc.update("DELETE FROM group_members WHERE group_id = ?", groupId);
        return jdbc.update("DELETE FROM chat_groups WHERE id = ?", groupId) > 0;
    }

    public Optional<Group> findById(long groupId) {
        return load("SELECT id, name, creator_id, created_at FROM chat_groups WHERE id = :id",
                Map.of("id", groupId)).stream().findFirst();
    }

    /** Groups the user belongs to, oldest first. */
    public List<Group> findByMember(long userId) {
        return load("SELECT g.id, g.name, g.creator_id, g.created_at FROM chat_groups g"
                        + " JOIN group_members m ON m.group_id = g.id"
                        + " WHERE m.user_id = :userId ORDER BY g.id",
                Map.of("userId", userId));
    }

    private List<Group> load(String sql, Map<String, ?> params) {
        Map<Long, GroupRow> rows = new LinkedHashMap<>();
        named.query(sql, params, rs -> {
            long id = rs.getLong("id");
            rows.put(id, new GroupRow(id, rs.getString("name"), rs.getLong("creator_id"),
                    rs.getObject("created_at", OffsetDateTime.class).toInstant()));
        });
        if (rows.isEmpty()) {
            return List.of();
        }
        Map<Long, Set<Long>> members = new HashMap<>();
        named.query("SELECT group_id, user_id FROM group_members WHERE group_id IN (:ids)",
                Map.of("ids", rows.keySet()),
                rs -> {
                    members.computeIfAbsent(rs.getLong("group_id"), k -> new HashSet<>())
                            .add(rs.getLong("user_id"));
                });
        return rows.values().stream()
                .map(row -> new Group(row.id(), row.name(), row.creatorId(),
                        members.getOrDefault(row.id(), Set.of()), row.createdAt()))
                .toList();
    }

    private record GroupRow(long id, String name, long creatorId, Instant createdAt) {}
}
