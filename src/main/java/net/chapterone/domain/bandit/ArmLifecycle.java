package net.chapterone.domain.bandit;

/**
 * Maturity of an arm model by number of applied rewards.
 */
public enum ArmLifecycle {
    /** No observations; A is the identity and exploration is widest. */
    UNINITIALIZED,
    WARM,
    /** Enough observations for statistics and best-arm reporting. */
    ACTIVE;

    public static ArmLifecycle of(long interactionCount, int minSamples) {
        if (interactionCount <= 0) {
            return UNINITIALIZED;
        }
        return interactionCount >= minSamples ? ACTIVE : WARM;
    }
}
