package net.chapterone.service.bandit;

import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import net.chapterone.domain.bandit.ArmKey;
import net.chapterone.domain.bandit.ArmParameters;
import net.chapterone.domain.bandit.ArmSnapshot;
import net.chapterone.domain.context.ContextVector;
import net.chapterone.repository.ArmParameterRepository;
import net.chapterone.service.BanditMetrics;
import net.chapterone.util.ValidationUtils;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.springframework.stereotype.Component;

/**
 * Applies attributed rewards to arm models.
 *
 * <p>One update is A ← A + xxᵀ, b ← b + r·x, θ ← A⁻¹b, interactionCount + 1, cumulativeReward + r.
 * The arm's update lock is held for the whole update including persistence, so updates to one arm are
 * serialized while different arms update in parallel, and a scope reset waits for them. The new parameters are persisted before they
 * are installed in memory; a failed write leaves the in-memory arm unchanged.</p>
 */
@Slf4j
@Component
public class ModelUpdater {

    private final ArmRegistry registry;
    private final ArmParameterRepository parameterRepository;
    private final BanditMetrics metrics;
    private final Clock clock;

    public ModelUpdater(ArmRegistry registry, ArmParameterRepository parameterRepository,
                        BanditMetrics metrics, Clock clock) {
        this.registry = registry;
        this.parameterRepository = parameterRepository;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @param key arm to update
     * @param context the context the arm was chosen for
     * @param reward decayed reward credited to the arm
     * @return snapshot of the arm after the update
     * @throws IllegalArgumentException when the reward is not finite or the context has the wrong dimension
     */
    public ArmSnapshot applyReward(ArmKey key, ContextVector context, double reward) {
        if (!ValidationUtils.isFinite(reward)) {
            throw new IllegalArgumentException("Reward must be finite for arm " + key.armId() + ": " + reward);
        }
        return registry.withUpdateLock(key, model -> {
            if (context.dimension() != model.dimension()) {
                throw new IllegalArgumentException("Context dimension " + context.dimension()
                    + " does not match arm dimension " + model.dimension());
            }
            RealVector x = new ArrayRealVector(context.toArray(), false);
            model.lock().lock();
            try {
                ArmParameters next = model.withObservation(x, reward, clock.instant());
                parameterRepository.save(next);
                boolean stable = model.install(next);
                if (!stable) {
                    metrics.incrementDegraded();
                }
                log.debug("Applied reward {} to arm {} in scope {} (interactions={})",
                    reward, key.armId(), key.scope(), next.interactionCount());
                return model.snapshot();
            } finally {
                model.lock().unlock();
            }
        });
    }
}
