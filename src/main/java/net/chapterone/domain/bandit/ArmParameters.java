package net.chapterone.domain.bandit;

import java.time.Instant;

/**
 * Persisted state of one arm model. θ and A⁻¹ are derived on load.
 *
 * @param key scope and arm id
 * @param designMatrix A, D×D, row-major
 * @param rewardVector b, length D
 * @param contextSum sum of every context vector applied, length D
 * @param interactionCount rewards applied
 * @param cumulativeReward sum of applied rewards
 * @param sumSquaredReward sum of squared applied rewards
 * @param updatedAt last update, null for a fresh arm
 */
public record ArmParameters(
    ArmKey key,
    double[][] designMatrix,
    double[] rewardVector,
    double[] contextSum,
    long interactionCount,
    double cumulativeReward,
    double sumSquaredReward,
    Instant updatedAt
) {

    /** Cold-start parameters: A = I, b = 0. */
    public static ArmParameters initial(ArmKey key, int dimension) {
        double[][] identity = new double[dimension][dimension];
        for (int i = 0; i < dimension; i++) {
            identity[i][i] = 1.0;
        }
        return new ArmParameters(key, identity, new double[dimension], new double[dimension], 0L, 0.0, 0.0, null);
    }

    public int dimension() {
        return rewardVector.length;
    }
}
