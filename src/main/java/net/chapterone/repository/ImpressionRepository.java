package net.chapterone.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.chapterone.domain.reward.Identity;
import net.chapterone.domain.reward.Impression;

/**
 * Durable store of recommendation impressions.
 */
public interface ImpressionRepository {

    /** Writes the impression atomically; it is visible to attribution once this returns. */
    void save(Impression impression);

    Optional<Impression> findImpressionById(UUID impressionId);

    /**
     * Most recent impression of {@code bookId} shown to a matching identity with
     * {@code earliest <= createdAt <= latest}; ties on createdAt go to the larger impression id.
     */
    Optional<Impression> findLatestAttributable(Identity identity, String bookId, Instant earliest, Instant latest);

    /** Impressions shown to a matching identity since {@code since}, newest first. */
    List<Impression> findRecentForIdentity(Identity identity, Instant since, int limit);

    /**
     * Assigns {@code userId} to every impression of the session that has no user yet.
     *
     * @return rows reassigned
     */
    int reassignImpressions(String sessionId, String userId);
}
