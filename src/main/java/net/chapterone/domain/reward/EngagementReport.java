package net.chapterone.domain.reward;

import java.time.Instant;
import java.util.List;

/**
 * Per-arm engagement of one reader between {@code from} and {@code to}, arms ordered by id.
 */
public record EngagementReport(Instant from, Instant to, int hours, List<ArmEngagement> arms) {

    public EngagementReport {
        arms = List.copyOf(arms);
    }
}
