package net.chapterone.domain.reward;

import java.time.Instant;
import java.util.UUID;

/**
 * An impression that has earned reward, as seen by the reader it was shown to.
 *
 * @param totalReward decayed reward accumulated by every action attributed to the impression
 * @param lastUpdated when the latest attribution landed
 */
public record RewardSignal(
    UUID impressionId,
    String bookId,
    String armId,
    int rank,
    double totalReward,
    Instant shownAt,
    Instant lastUpdated
) {

    public static RewardSignal of(Impression impression) {
        double reward = impression.reward() == null ? 0.0 : impression.reward();
        Instant updated = impression.attributedAt() == null ? impression.createdAt() : impression.attributedAt();
        return new RewardSignal(impression.impressionId(), impression.bookId(), impression.armId(),
            impression.rank(), reward, impression.createdAt(), updated);
    }
}
