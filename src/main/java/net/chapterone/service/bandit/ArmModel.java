package net.chapterone.service.bandit;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import net.chapterone.domain.bandit.ArmKey;
import net.chapterone.domain.bandit.ArmParameters;
import net.chapterone.domain.bandit.ArmSnapshot;
import net.chapterone.exception.NumericInstabilityException;
import net.chapterone.util.LoggingUtils;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Mutable state of one arm: A, b, the derived A⁻¹ and θ, and reward counters.
 *
 * <p>Guarded by {@link #lock()}. The model updater is the only writer; readers take the lock just
 * long enough to copy a {@link ArmSnapshot}.</p>
 */
@Slf4j
final class ArmModel {

    private final ArmKey key;
    private final ReentrantLock lock = new ReentrantLock();

    private RealMatrix designMatrix;
    private RealVector rewardVector;
    private RealVector contextSum;
    private RealMatrix inverseDesignMatrix;
    private RealVector theta;
    private long interactionCount;
    private double cumulativeReward;
    private double sumSquaredReward;
    private boolean degraded;
    private Instant updatedAt;

    private ArmModel(ArmKey key) {
        this.key = key;
    }

    static ArmModel fromParameters(ArmParameters parameters) {
        ArmModel model = new ArmModel(parameters.key());
        model.install(parameters);
        return model;
    }

    ArmKey key() {
        return key;
    }

    ReentrantLock lock() {
        return lock;
    }

    /**
     * Replaces the state with {@code parameters} and re-derives A⁻¹ and θ. Caller holds the lock.
     *
     * @return true when the Cholesky inverse succeeded; false when the arm fell back to a pseudo-inverse
     */
    boolean install(ArmParameters parameters) {
        designMatrix = MatrixUtils.createRealMatrix(parameters.designMatrix());
        rewardVector = new ArrayRealVector(parameters.rewardVector());
        contextSum = new ArrayRealVector(parameters.contextSum());
        interactionCount = parameters.interactionCount();
        cumulativeReward = parameters.cumulativeReward();
        sumSquaredReward = parameters.sumSquaredReward();
        updatedAt = parameters.updatedAt();
        try {
            inverseDesignMatrix = MatrixInverter.invertSpd(key.armId(), designMatrix);
            degraded = false;
        } catch (NumericInstabilityException ex) {
            LoggingUtils.error(log, ex, "Arm {} in scope {} degraded; using pseudo-inverse until its next successful update",
                key.armId(), key.scope());
            inverseDesignMatrix = MatrixInverter.pseudoInverse(designMatrix);
            degraded = true;
        }
        theta = inverseDesignMatrix.operate(rewardVector);
        return !degraded;
    }

    /**
     * Parameters after one more observation (A + xxᵀ, b + r·x), without touching this model. Caller holds the lock.
     */
    ArmParameters withObservation(RealVector x, double reward, Instant at) {
        RealMatrix nextA = designMatrix.add(x.outerProduct(x));
        RealVector nextB = rewardVector.add(x.mapMultiply(reward));
        RealVector nextSum = contextSum.add(x);
        return new ArmParameters(key, nextA.getData(), nextB.toArray(), nextSum.toArray(),
            interactionCount + 1, cumulativeReward + reward, sumSquaredReward + reward * reward, at);
    }

    ArmParameters toParameters() {
        return new ArmParameters(key, designMatrix.getData(), rewardVector.toArray(), contextSum.toArray(),
            interactionCount, cumulativeReward, sumSquaredReward, updatedAt);
    }

    ArmSnapshot snapshot() {
        lock.lock();
        try {
            return new ArmSnapshot(key, theta.copy(), inverseDesignMatrix.copy(), contextSum.copy(),
                interactionCount, cumulativeReward, sumSquaredReward, degraded, updatedAt);
        } finally {
            lock.unlock();
        }
    }

    RealMatrix designMatrix() {
        return designMatrix;
    }

    int dimension() {
        return rewardVector.getDimension();
    }
}
