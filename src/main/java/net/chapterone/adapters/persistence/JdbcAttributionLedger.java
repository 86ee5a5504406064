package net.chapterone.adapters.persistence;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;
import net.chapterone.repository.AttributionLedger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Commits attributions in one transaction: the conditional marker update on the action decides
 * whether the impression's reward is incremented and the model update runs. The arm parameter
 * write of the model update joins the same transaction, so a failed update rolls the marker back.
 */
@Repository
@ConditionalOnProperty(name = "app.persistence.mode", havingValue = "jdbc")
public class JdbcAttributionLedger implements AttributionLedger {

    private final JdbcTemplate jdbcTemplate;

    public JdbcAttributionLedger(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public boolean commitAttribution(UUID actionId, UUID impressionId, double rewardDelta, Instant attributedAt,
                                     Runnable modelUpdate) {
        Timestamp at = Timestamp.from(attributedAt);
        try {
            int marked = jdbcTemplate.update("""
                UPDATE recommendation_actions
                SET attributed_at = ?, attributed_impression_id = ?
                WHERE id = ? AND attributed_at IS NULL
                """, at, impressionId, actionId);
            if (marked == 0) {
                return false;
            }
            int credited = jdbcTemplate.update("""
                UPDATE recommendation_impressions
                SET reward = COALESCE(reward, 0) + ?, attributed_at = ?
                WHERE id = ?
                """, rewardDelta, at, impressionId);
            if (credited == 0) {
                throw new IllegalStateException("Impression " + impressionId + " vanished while attributing action "
                    + actionId);
            }
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to attribute action " + actionId + " to impression "
                + impressionId, ex);
        }
        modelUpdate.run();
        return true;
    }
}
