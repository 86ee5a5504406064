package net.chapterone.service.bandit;

import jakarta.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.chapterone.config.BanditProperties;
import net.chapterone.domain.bandit.ArmKey;
import net.chapterone.domain.bandit.ArmScore;
import net.chapterone.domain.bandit.ArmSelection;
import net.chapterone.domain.bandit.ArmSnapshot;
import net.chapterone.domain.context.ContextVector;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.springframework.stereotype.Component;

/**
 * Disjoint LinUCB arm selection.
 *
 * <p>For context x each arm scores {@code θ·x + α·sqrt(xᵀA⁻¹x)}. The highest score wins; ties go to
 * the arm with fewer interactions, then to the lexically smaller arm id. Degraded arms are skipped.
 * Selection reads snapshots only, so it never blocks the updater beyond the snapshot copy.</p>
 */
@Slf4j
@Component
public class LinUcbSelector {

    static final Comparator<ArmScore> SELECTION_ORDER = Comparator
        .comparingDouble(ArmScore::ucbScore).reversed()
        .thenComparingLong(ArmScore::interactionCount)
        .thenComparing(ArmScore::armId);

    private final ArmRegistry registry;
    private final BanditProperties properties;

    public LinUcbSelector(ArmRegistry registry, BanditProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    /**
     * Picks an arm for the context.
     *
     * @param context encoded reading context
     * @param armIds candidate arms
     * @param userId signed-in user, selects the per-user scope when enabled
     * @return the selection, or empty when no arm is eligible
     */
    public Optional<ArmSelection> selectArm(ContextVector context, Collection<String> armIds, @Nullable String userId) {
        String scope = registry.scopeFor(userId);
        Optional<ArmSelection> selection = selectFromSnapshots(context, registry.snapshots(scope, armIds),
            properties.getAlpha(), properties.getEpsilon());
        selection.ifPresent(chosen -> {
            boolean exploratory = chosen.confidenceBonus() * properties.getAlpha() > chosen.predictedReward();
            registry.recordSelection(new ArmKey(scope, chosen.armId()), exploratory);
        });
        return selection;
    }

    /**
     * Deterministic selection over fixed snapshots.
     */
    static Optional<ArmSelection> selectFromSnapshots(ContextVector context, List<ArmSnapshot> snapshots,
                                                      double alpha, double epsilon) {
        RealVector x = new ArrayRealVector(context.toArray(), false);
        List<ArmScore> considered = new ArrayList<>();
        List<String> excluded = new ArrayList<>();
        for (ArmSnapshot snapshot : snapshots) {
            if (snapshot.degraded()) {
                excluded.add(snapshot.armId());
                continue;
            }
            considered.add(score(snapshot, x, alpha, epsilon));
        }
        if (!excluded.isEmpty()) {
            log.warn("Excluded degraded arms from selection: {}", excluded);
        }
        if (considered.isEmpty()) {
            return Optional.empty();
        }
        ArmScore chosen = considered.stream().min(SELECTION_ORDER).orElseThrow();
        return Optional.of(new ArmSelection(chosen, considered, excluded));
    }

    static ArmScore score(ArmSnapshot snapshot, RealVector x, double alpha, double epsilon) {
        if (x.getDimension() != snapshot.theta().getDimension()) {
            throw new IllegalArgumentException("Context dimension " + x.getDimension()
                + " does not match arm dimension " + snapshot.theta().getDimension());
        }
        double predictedReward = snapshot.theta().dotProduct(x);
        double variance = snapshot.inverseDesignMatrix().operate(x).dotProduct(x);
        double confidenceBonus = Math.sqrt(Math.max(0.0, variance));
        double ucbScore = predictedReward + alpha * confidenceBonus;
        double explorationLevel = confidenceBonus / (predictedReward + confidenceBonus + epsilon);
        return new ArmScore(snapshot.armId(), predictedReward, confidenceBonus, ucbScore, explorationLevel,
            snapshot.interactionCount());
    }
}
