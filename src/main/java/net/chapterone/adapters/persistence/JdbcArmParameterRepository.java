package net.chapterone.adapters.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import net.chapterone.domain.bandit.ArmKey;
import net.chapterone.domain.bandit.ArmParameters;
import net.chapterone.repository.ArmParameterRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Stores arm model parameters in {@code bandit_arm_parameters}, one row per (scope, arm).
 */
@Repository
@ConditionalOnProperty(name = "app.persistence.mode", havingValue = "jdbc")
public class JdbcArmParameterRepository implements ArmParameterRepository {

    private static final String SELECT_COLUMNS = """
        SELECT scope, arm_id, a_matrix::text AS a_matrix, b_vector::text AS b_vector,
               context_sum::text AS context_sum, interaction_count, cumulative_reward, sum_squared_reward, updated_at
        FROM bandit_arm_parameters
        """;

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumnCodec codec;
    private final RowMapper<ArmParameters> rowMapper;

    public JdbcArmParameterRepository(JdbcTemplate jdbcTemplate, JsonColumnCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.rowMapper = this::mapParameters;
    }

    @Override
    public Optional<ArmParameters> find(ArmKey key) {
        try {
            return jdbcTemplate.query(SELECT_COLUMNS + "WHERE scope = ? AND arm_id = ?", rowMapper,
                key.scope(), key.armId()).stream().findFirst();
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to load arm " + key.armId() + " in scope " + key.scope(), ex);
        }
    }

    @Override
    public List<ArmParameters> findByScope(String scope) {
        try {
            return jdbcTemplate.query(SELECT_COLUMNS + "WHERE scope = ? ORDER BY arm_id", rowMapper, scope);
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to load arms of scope " + scope, ex);
        }
    }

    @Override
    public void save(ArmParameters parameters) {
        String sql = """
            INSERT INTO bandit_arm_parameters
                (scope, arm_id, a_matrix, b_vector, context_sum, interaction_count, cumulative_reward,
                 sum_squared_reward, updated_at)
            VALUES (?, ?, ?::jsonb, ?::jsonb, ?::jsonb, ?, ?, ?, ?)
            ON CONFLICT (scope, arm_id) DO UPDATE SET
                a_matrix = EXCLUDED.a_matrix,
                b_vector = EXCLUDED.b_vector,
                context_sum = EXCLUDED.context_sum,
                interaction_count = EXCLUDED.interaction_count,
                cumulative_reward = EXCLUDED.cumulative_reward,
                sum_squared_reward = EXCLUDED.sum_squared_reward,
                updated_at = EXCLUDED.updated_at
            """;
        ArmKey key = parameters.key();
        try {
            jdbcTemplate.update(sql, ps -> {
                ps.setString(1, key.scope());
                ps.setString(2, key.armId());
                ps.setString(3, codec.write(parameters.designMatrix()));
                ps.setString(4, codec.write(parameters.rewardVector()));
                ps.setString(5, codec.write(parameters.contextSum()));
                ps.setLong(6, parameters.interactionCount());
                ps.setDouble(7, parameters.cumulativeReward());
                ps.setDouble(8, parameters.sumSquaredReward());
                ps.setTimestamp(9, parameters.updatedAt() == null ? null : Timestamp.from(parameters.updatedAt()));
            });
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to persist arm " + key.armId() + " in scope " + key.scope(), ex);
        }
    }

    @Override
    public int deleteScope(String scope) {
        try {
            return jdbcTemplate.update("DELETE FROM bandit_arm_parameters WHERE scope = ?", scope);
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to reset arms of scope " + scope, ex);
        }
    }

    @Override
    public int deleteAll() {
        try {
            return jdbcTemplate.update("DELETE FROM bandit_arm_parameters");
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to reset arm parameters", ex);
        }
    }

    private ArmParameters mapParameters(ResultSet rs, int rowNum) throws SQLException {
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        return new ArmParameters(
            new ArmKey(rs.getString("scope"), rs.getString("arm_id")),
            codec.readMatrix(rs.getString("a_matrix")),
            codec.readVector(rs.getString("b_vector")),
            codec.readVector(rs.getString("context_sum")),
            rs.getLong("interaction_count"),
            rs.getDouble("cumulative_reward"),
            rs.getDouble("sum_squared_reward"),
            updatedAt == null ? null : updatedAt.toInstant());
    }
}
