package net.chapterone.service.bandit;

import jakarta.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import net.chapterone.config.BanditProperties;
import net.chapterone.domain.bandit.ArmKey;
import net.chapterone.domain.bandit.ArmLifecycle;
import net.chapterone.domain.bandit.ArmSnapshot;
import net.chapterone.domain.bandit.ArmStatistics;
import net.chapterone.domain.bandit.BanditStatistics;
import net.chapterone.service.strategy.StrategyCatalog;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.springframework.stereotype.Service;

/**
 * Per-arm performance statistics.
 *
 * <p>The reward interval is a Wald interval {@code mean ± z·se} whose standard error scales the
 * reward variance by the model's uncertainty at the arm's mean context: {@code se² = s²·x̄ᵀA⁻¹x̄}.
 * The lower bound is clamped at 0; an arm with no observations reports [0, 0].</p>
 */
@Service
public class BanditStatsAggregator {

    private final ArmRegistry registry;
    private final StrategyCatalog strategyCatalog;
    private final BanditProperties properties;

    public BanditStatsAggregator(ArmRegistry registry, StrategyCatalog strategyCatalog, BanditProperties properties) {
        this.registry = registry;
        this.strategyCatalog = strategyCatalog;
        this.properties = properties;
    }

    /**
     * Statistics of every registered arm in the user's scope (the global scope when no user is given).
     */
    public BanditStatistics getArmStatistics(@Nullable String userId) {
        String scope = registry.scopeFor(userId);
        List<ArmStatistics> arms = new ArrayList<>();
        long totalInteractions = 0;
        long exploratory = 0;
        for (ArmSnapshot snapshot : registry.snapshots(scope, strategyCatalog.armIds())) {
            ArmKey key = snapshot.key();
            arms.add(statisticsFor(snapshot, strategyCatalog.displayName(snapshot.armId()),
                registry.timesSelected(key)));
            totalInteractions += snapshot.interactionCount();
            exploratory += registry.exploratorySelections(key);
        }
        return new BanditStatistics(scope, arms, bestPerformingArm(arms, properties.getMinSamples()),
            totalInteractions, exploratory, properties.getAlpha());
    }

    ArmStatistics statisticsFor(ArmSnapshot snapshot, String armName, long timesSelected) {
        long n = snapshot.interactionCount();
        double mean = snapshot.averageReward();
        double[] interval = confidenceInterval(snapshot, properties.getConfidenceZ(), properties.getPriorVariance());
        return new ArmStatistics(
            snapshot.armId(),
            armName,
            ArmLifecycle.of(n, properties.getMinSamples()),
            n,
            timesSelected,
            snapshot.cumulativeReward(),
            mean,
            interval[0],
            interval[1],
            posteriorUncertainty(snapshot.inverseDesignMatrix()),
            snapshot.degraded(),
            snapshot.updatedAt());
    }

    /**
     * @return {lower, upper}; lower is never negative and upper is never below lower
     */
    static double[] confidenceInterval(ArmSnapshot snapshot, double z, double priorVariance) {
        long n = snapshot.interactionCount();
        if (n == 0) {
            return new double[] {0.0, 0.0};
        }
        double mean = snapshot.averageReward();
        double variance = n < 2
            ? priorVariance
            : Math.max(0.0, (snapshot.sumSquaredReward() - n * mean * mean) / (n - 1));
        RealVector meanContext = snapshot.contextSum().mapDivide(n);
        double spread = Math.max(0.0, snapshot.inverseDesignMatrix().operate(meanContext).dotProduct(meanContext));
        double standardError = Math.sqrt(variance * spread);
        double lower = Math.max(0.0, mean - z * standardError);
        double upper = Math.max(lower, mean + z * standardError);
        return new double[] {lower, upper};
    }

    /** sqrt(trace(A⁻¹) / D): 1.0 at cold start, shrinking as evidence accumulates. */
    static double posteriorUncertainty(RealMatrix inverseDesignMatrix) {
        int dimension = inverseDesignMatrix.getRowDimension();
        return dimension == 0 ? 0.0 : Math.sqrt(Math.max(0.0, inverseDesignMatrix.getTrace()) / dimension);
    }

    /**
     * Highest average reward among arms with at least {@code minSamples} observations; ties go to the
     * lexically smaller arm id.
     */
    static String bestPerformingArm(List<ArmStatistics> arms, int minSamples) {
        return arms.stream()
            .filter(arm -> arm.interactionCount() >= minSamples)
            .min(Comparator.comparingDouble(ArmStatistics::averageReward).reversed()
                .thenComparing(ArmStatistics::armId))
            .map(ArmStatistics::armId)
            .orElse(null);
    }
}
