package net.chapterone.exception;

/**
 * The design matrix of an arm could not be inverted with a Cholesky factorization.
 * RETRYABLE: Yes, the next successful update restores the arm.
 */
public class NumericInstabilityException extends RecommendationCoreException {
    private final String armId;

    public NumericInstabilityException(String armId, String detail, Throwable cause) {
        super("Design matrix inversion failed for arm " + armId + ": " + detail, true, cause);
        this.armId = armId;
    }

    public String getArmId() {
        return armId;
    }
}
