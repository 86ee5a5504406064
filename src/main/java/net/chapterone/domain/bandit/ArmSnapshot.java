package net.chapterone.domain.bandit;

import jakarta.annotation.Nullable;
import java.time.Instant;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Point-in-time copy of an arm model, safe to read without holding the arm lock.
 */
public record ArmSnapshot(
    ArmKey key,
    RealVector theta,
    RealMatrix inverseDesignMatrix,
    RealVector contextSum,
    long interactionCount,
    double cumulativeReward,
    double sumSquaredReward,
    boolean degraded,
    @Nullable Instant updatedAt
) {

    public String armId() {
        return key.armId();
    }

    public double averageReward() {
        return interactionCount == 0 ? 0.0 : cumulativeReward / interactionCount;
    }
}
