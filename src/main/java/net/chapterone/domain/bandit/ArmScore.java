package net.chapterone.domain.bandit;

/**
 * UCB breakdown for one arm in one selection.
 */
public record ArmScore(
    String armId,
    double predictedReward,
    double confidenceBonus,
    double ucbScore,
    double explorationLevel,
    long interactionCount
) {
}
