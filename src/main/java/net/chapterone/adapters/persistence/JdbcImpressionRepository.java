package net.chapterone.adapters.persistence;

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
import net.chapterone.domain.context.ContextVector;
import net.chapterone.domain.reward.Identity;
import net.chapterone.domain.reward.Impression;
import net.chapterone.repository.ImpressionRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Stores impressions in {@code recommendation_impressions}.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "app.persistence.mode", havingValue = "jdbc")
public class JdbcImpressionRepository implements ImpressionRepository {

    private static final String SELECT_COLUMNS = """
        SELECT id, user_id, session_id, book_id, context_vector::text AS context_vector, arm_id, rank, score,
               metadata::text AS metadata, reward, attributed_at, created_at
        FROM recommendation_impressions
        """;

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumnCodec codec;
    private final RowMapper<Impression> rowMapper;

    public JdbcImpressionRepository(JdbcTemplate jdbcTemplate, JsonColumnCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.rowMapper = this::mapImpression;
    }

    @Override
    public void save(Impression impression) {
        String sql = """
            INSERT INTO recommendation_impressions
                (id, user_id, session_id, book_id, context_vector, arm_id, rank, score, metadata, reward,
                 attributed_at, created_at)
            VALUES (?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?::jsonb, ?, ?, ?)
            """;
        try {
            jdbcTemplate.update(sql, ps -> {
                ps.setObject(1, impression.impressionId());
                ps.setString(2, impression.identity().userId());
                ps.setString(3, impression.identity().sessionId());
                ps.setString(4, impression.bookId());
                ps.setString(5, codec.write(impression.context().toArray()));
                ps.setString(6, impression.armId());
                ps.setInt(7, impression.rank());
                ps.setDouble(8, impression.score());
                ps.setString(9, codec.write(impression.metadata()));
                if (impression.reward() == null) {
                    ps.setNull(10, Types.DOUBLE);
                } else {
                    ps.setDouble(10, impression.reward());
                }
                ps.setTimestamp(11, impression.attributedAt() == null ? null : Timestamp.from(impression.attributedAt()));
                ps.setTimestamp(12, Timestamp.from(impression.createdAt()));
            });
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to record impression " + impression.impressionId()
                + " for book " + impression.bookId(), ex);
        }
    }

    @Override
    public Optional<Impression> findImpressionById(UUID impressionId) {
        try {
            return jdbcTemplate.query(SELECT_COLUMNS + "WHERE id = ?", rowMapper, impressionId).stream().findFirst();
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to load impression " + impressionId, ex);
        }
    }

    @Override
    public Optional<Impression> findLatestAttributable(Identity identity, String bookId, Instant earliest,
                                                       Instant latest) {
        List<Object> args = new ArrayList<>();
        args.add(bookId);
        String identityClause = IdentitySql.matchClause(identity, args);
        args.add(Timestamp.from(earliest));
        args.add(Timestamp.from(latest));
        String sql = SELECT_COLUMNS + """
            WHERE book_id = ?
              AND %s
              AND created_at >= ?
              AND created_at <= ?
            ORDER BY created_at DESC, id DESC
            LIMIT 1
            """.formatted(identityClause);
        try {
            return jdbcTemplate.query(sql, rowMapper, args.toArray()).stream().findFirst();
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to find attributable impression for book " + bookId, ex);
        }
    }

    @Override
    public List<Impression> findRecentForIdentity(Identity identity, Instant since, int limit) {
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
            return jdbcTemplate.query(sql, rowMapper, args.toArray());
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to load recent impressions", ex);
        }
    }

    @Override
    public int reassignImpressions(String sessionId, String userId) {
        try {
            int updated = jdbcTemplate.update(
                "UPDATE recommendation_impressions SET user_id = ? WHERE session_id = ? AND user_id IS NULL",
                userId, sessionId);
            log.debug("Reassigned {} impressions from session {} to user {}", updated, sessionId, userId);
            return updated;
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to reassign impressions of session " + sessionId, ex);
        }
    }

    private Impression mapImpression(ResultSet rs, int rowNum) throws SQLException {
        Timestamp attributedAt = rs.getTimestamp("attributed_at");
        double reward = rs.getDouble("reward");
        Double nullableReward = rs.wasNull() ? null : reward;
        return new Impression(
            rs.getObject("id", UUID.class),
            new Identity(rs.getString("user_id"), rs.getString("session_id")),
            rs.getString("book_id"),
            ContextVector.of(codec.readVector(rs.getString("context_vector"))),
            rs.getString("arm_id"),
            rs.getInt("rank"),
            rs.getDouble("score"),
            codec.readMetadata(rs.getString("metadata")),
            rs.getTimestamp("created_at").toInstant(),
            nullableReward,
            attributedAt == null ? null : attributedAt.toInstant());
    }
}
