package net.chapterone.domain.bandit;

import jakarta.annotation.Nullable;
import java.time.Instant;

/**
 * Reported performance of one arm.
 */
public record ArmStatistics(
    String armId,
    String armName,
    ArmLifecycle lifecycle,
    long interactionCount,
    long timesSelected,
    double cumulativeReward,
    double averageReward,
    double confidenceLower,
    double confidenceUpper,
    double uncertainty,
    boolean degraded,
    @Nullable Instant lastUpdated
) {
}
