package net.chapterone.repository;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import net.chapterone.domain.reward.AttributionCursor;
import net.chapterone.domain.reward.Identity;
import net.chapterone.domain.reward.UserAction;

/**
 * Durable store of reader actions. Every action is kept; nothing is deduplicated.
 */
public interface ActionRepository {

    void save(UserAction action);

    Optional<UserAction> findActionById(UUID actionId);

    /**
     * One page of actions created at or after {@code since} that carry neither an attribution marker nor an
     * examined marker, ordered by (createdAt, actionId) and strictly after {@code cursor} when one is given.
     */
    List<UserAction> findUnattributed(Instant since, @Nullable AttributionCursor cursor, int limit);

    /**
     * Records that attribution looked at the action and found nothing to credit. Examined actions stay
     * unattributed but drop out of {@link #findUnattributed}.
     */
    void markExamined(UUID actionId, Instant examinedAt);

    /** Actions created at or after {@code since}, any identity, oldest first. */
    List<UserAction> findSince(Instant since, int limit);

    /** Actions of a matching identity created at or after {@code since}, newest first. */
    List<UserAction> findForIdentity(Identity identity, Instant since, int limit);

    /**
     * Assigns {@code userId} to every action of the session that has no user yet and clears their
     * examined marker, since the new identity can match impressions the session alone could not.
     *
     * @return rows reassigned
     */
    int reassignActions(String sessionId, String userId);
}
