package com.parley.feedservice.infrastructure.persistence;

import com.parley.feedmodel.Message;
import com.parley.pagination.IdBound;
import com.parley.pagination.RecordSource;
import com.parley.pagination.ScanOrder;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Repository;

/**
 * Message table access: the ordered-scan primitive the pagination engine runs on, plus inserts.
 *
 * <p>Every query is served by the {@code (group_id, id)} index. Failures surface as Spring
 * {@code DataAccessException}s; the pagination engine reports them as source unavailability.
 */
@Repository
public class JdbcMessageStore implements RecordSource<Message> {

    private static final String SELECT = "SELECT id, group_id, author_id, text, created_at FROM messages";

    private static final RowMapper<Message> MESSAGE_MAPPER = (rs, rowNum) -> new Message(
            rs.getLong("id"),
            rs.getLong("group_id"),
            rs.getLong("author_id"),
            rs.getString("text"),
            rs.getObject("created_at", OffsetDateTime.class).toInstant());

    private final JdbcTemplate jdbc;
    private final SimpleJdbcInsert insert;

    public JdbcMessageStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
        this.insert = new SimpleJdbcInsert(jdbc)
                .withTableName("messages")
                .usingColumns("group_id", "author_id", "text", "created_at")
                .usingGeneratedKeyColumns("id");
    }

    @Override
    public List<Message> scan(long containerId, IdBound bound, ScanOrder order, int limit) {
        List<Object> args = new ArrayList<>();
        String sql = SELECT + where(containerId, bound, args)
                + (order == ScanOrder.NEWEST_FIRST ? " ORDER BY id DESC" : " ORDER BY id ASC")
                + " LIMIT ?";
        args.add(limit);
        return jdbc.query(sql, MESSAGE_MAPPER, args.toArray());
    }

    @Override
    public boolean exists(long containerId, IdBound bound) {
        List<Object> args = new ArrayList<>();
        String sql = "SELECT EXISTS (SELECT 1 FROM messages" + where(containerId, bound, args) + ")";
        return Boolean.TRUE.equals(jdbc.queryForObject(sql, Boolean.class, args.toArray()));
    }

    /** Stores a new message and returns it with its assigned id. */
    public Message insert(long groupId, long authorId, String text, Instant createdAt) {
        Number id = insert.executeAndReturnKey(Map.of(
                "group_id", groupId,
                "author_id", authorId,
                "text", text,
                "created_at", OffsetDateTime.ofInstant(createdAt, ZoneOffset.UTC)));
        return new Message(id.longValue(), groupId, authorId, text, createdAt);
    }

    private static String where(long containerId, IdBound bound, List<Object> args) {
        args.add(containerId);
        return switch (bound.kind()) {
            case NONE -> " WHERE group_id = ?";
            case OLDER_THAN -> {
                args.add(bound.pivot());
                yield " WHERE group_id = ? AND id < ?";
            }
            case NEWER_THAN -> {
                args.add(bound.pivot());
                yield " WHERE group_id = ? AND id > ?";
            }
        };
    }
}
