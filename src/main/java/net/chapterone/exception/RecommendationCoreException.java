package net.chapterone.exception;

/**
 * Base exception for recommendation core failures.
 * Subclasses indicate whether a batch may continue past the failure.
 */
public abstract class RecommendationCoreException extends RuntimeException {
    private final boolean recoverable;

    protected RecommendationCoreException(String message, boolean recoverable, Throwable cause) {
        super(message, cause);
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
