package net.chapterone.domain.bandit;

import java.util.List;

/**
 * The arm chosen for a context plus the scores of every arm that was considered.
 *
 * @param chosen winning arm breakdown
 * @param considered every eligible arm, in evaluation order
 * @param excluded arms skipped because their model is degraded
 */
public record ArmSelection(ArmScore chosen, List<ArmScore> considered, List<String> excluded) {

    public ArmSelection {
        considered = List.copyOf(considered);
        excluded = List.copyOf(excluded);
    }

    public String armId() {
        return chosen.armId();
    }

    public double predictedReward() {
        return chosen.predictedReward();
    }

    public double confidenceBonus() {
        return chosen.confidenceBonus();
    }

    public double ucbScore() {
        return chosen.ucbScore();
    }

    public double explorationLevel() {
        return chosen.explorationLevel();
    }
}
