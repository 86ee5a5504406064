package net.chapterone.repository;

import java.time.Instant;
import java.util.UUID;

/**
 * Writes an attribution as one unit: the action's idempotency marker, the impression's reward increment
 * and the arm model update.
 */
public interface AttributionLedger {

    /**
     * Marks the action attributed to the impression, adds {@code rewardDelta} to the impression's reward and
     * runs {@code modelUpdate}, all or nothing. A {@code modelUpdate} that throws undoes the marker and the
     * reward increment, and the exception propagates.
     *
     * @param modelUpdate applies the reward to the originating arm; runs only when the marker was written
     * @return false when the action already carried a marker; nothing is written in that case
     */
    boolean commitAttribution(UUID actionId, UUID impressionId, double rewardDelta, Instant attributedAt,
                              Runnable modelUpdate);
}
