package net.chapterone.domain.bandit;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Per-arm statistics for one scope.
 *
 * @param bestPerformingArm highest average reward among arms with enough samples, null when none qualifies
 */
public record BanditStatistics(
    String scope,
    List<ArmStatistics> arms,
    @Nullable String bestPerformingArm,
    long totalInteractions,
    long exploratorySelections,
    double alpha
) {

    public BanditStatistics {
        arms = List.copyOf(arms);
    }
}
