package net.chapterone.adapters.persistence;

import jakarta.annotation.Nullable;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import net.chapterone.domain.reward.ActionType;
import net.chapterone.domain.reward.AttributionCursor;
import net.chapterone.domain.reward.Identity;
import net.chapterone.domain.reward.UserAction;
import net.chapterone.exception.RecommendationValidationException;
import net.chapterone.repository.ActionRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Stores reader actions in {@code recommendation_actions}.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "app.persistence.mode", havingValue = "jdbc")
public class JdbcActionRepository implements ActionRepository {

    private static final String SELECT_COLUMNS = """
        SELECT id, user_id, session_id, book_id, action_type, action_value, created_at,
               attributed_at, attributed_impression_id
        FROM recommendation_actions
        """;

    static final RowMapper<UserAction> ROW_MAPPER = JdbcActionRepository::mapAction;

    private final JdbcTemplate jdbcTemplate;

    public JdbcActionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void save(UserAction action) {
        String sql = """
            INSERT INTO recommendation_actions
                (id, user_id, session_id, book_id, action_type, action_value, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        try {
            jdbcTemplate.update(sql, ps -> {
                ps.setObject(1, action.actionId());
                ps.setString(2, action.identity().userId());
                ps.setString(3, action.identity().sessionId());
                ps.setString(4, action.bookId());
                ps.setString(5, action.actionType().value());
                if (action.actionValue() == null) {
                    ps.setNull(6, Types.DOUBLE);
                } else {
                    ps.setDouble(6, action.actionValue());
                }
                ps.setTimestamp(7, Timestamp.from(action.createdAt()));
            });
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to record " + action.actionType().value()
                + " action on book " + action.bookId(), ex);
        }
    }

    @Override
    public Optional<UserAction> findActionById(UUID actionId) {
        try {
            return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", ROW_MAPPER, actionId).stream().findFirst();
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to load action " + actionId, ex);
        }
    }

    @Override
    public List<UserAction> findUnattributed(Instant since, @Nullable AttributionCursor cursor, int limit) {
        List<Object> args = new ArrayList<>();
        args.add(Timestamp.from(since));
        String cursorClause = "";
        if (cursor != null) {
            cursorClause = "AND (created_at, id) > (?, ?)";
            args.add(Timestamp.from(cursor.createdAt()));
            args.add(cursor.actionId());
        }
        args.add(limit);
        String sql = SELECT_COLUMNS + """
            WHERE attributed_at IS NULL
              AND examined_at IS NULL
              AND created_at >= ?
              %s
            ORDER BY created_at, id
            LIMIT ?
            """.formatted(cursorClause);
        try {
            return jdbcTemplate.query(sql, ROW_MAPPER, args.toArray());
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to scan unattributed actions since " + since, ex);
        }
    }

    @Override
    public void markExamined(UUID actionId, Instant examinedAt) {
        try {
            jdbcTemplate.update(
                "UPDATE recommendation_actions SET examined_at = ? WHERE id = ? AND attributed_at IS NULL",
                Timestamp.from(examinedAt), actionId);
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to mark action " + actionId + " examined", ex);
        }
    }

    @Override
    public List<UserAction> findSince(Instant since, int limit) {
        String sql = SELECT_COLUMNS + """
            WHERE created_at >= ?
            ORDER BY created_at, id
            LIMIT ?
            """;
        try {
            return jdbcTemplate.query(sql, ROW_MAPPER, Timestamp.from(since), limit);
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to load actions since " + since, ex);
        }
    }

    @Override
    public List<UserAction> findForIdentity(Identity identity, Instant since, int limit) {
        List<Object> args = new ArrayList<>();
        String identityClause = IdentitySql.matchClause(identity, args);
        args.add(Timestamp.from(since));
        args.add(limit);
        String sql = SELECT_COLUMNS + """
            WHERE %s
              AND created_at >= ?
            ORDER BY created_at DESC, id DESC
            LIMIT ?
            """.formatted(identityClause);
        try {
            return jdbcTemplate.query(sql, ROW_MAPPER, args.toArray());
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to load actions for identity", ex);
        }
    }

    @Override
    public int reassignActions(String sessionId, String userId) {
        try {
            int updated = jdbcTemplate.update("""
                UPDATE recommendation_actions
                SET user_id = ?, examined_at = NULL
                WHERE session_id = ? AND user_id IS NULL
                """, userId, sessionId);
            log.debug("Reassigned {} actions from session {} to user {}", updated, sessionId, userId);
            return updated;
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to reassign actions of session " + sessionId, ex);
        }
    }

    /** Unknown stored types map to null so attribution counts the row as malformed instead of failing the page. */
    private static ActionType parseActionType(String stored) {
        try {
            return ActionType.fromValue(stored);
        } catch (RecommendationValidationException ex) {
            log.warn("Unknown action_type '{}' in recommendation_actions", stored);
            return null;
        }
    }

    private static UserAction mapAction(ResultSet rs, int rowNum) throws SQLException {
        double value = rs.getDouble("action_value");
        Double actionValue = rs.wasNull() ? null : value;
        Timestamp attributedAt = rs.getTimestamp("attributed_at");
        return new UserAction(
            rs.getObject("id", UUID.class),
            new Identity(rs.getString("user_id"), rs.getString("session_id")),
            rs.getString("book_id"),
            parseActionType(rs.getString("action_type")),
            actionValue,
            rs.getTimestamp("created_at").toInstant(),
            attributedAt == null ? null : attributedAt.toInstant(),
            rs.getObject("attributed_impression_id", UUID.class));
    }
}
