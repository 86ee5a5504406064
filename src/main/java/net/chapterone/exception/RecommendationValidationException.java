package net.chapterone.exception;

import jakarta.annotation.Nullable;

/**
 * Caller input was malformed (unknown action type, out-of-range rating, missing identity).
 * RETRYABLE: No. Nothing was written.
 */
public class RecommendationValidationException extends RecommendationCoreException {

    @Nullable
    private final String field;

    public RecommendationValidationException(String message) {
        this(null, message);
    }

    public RecommendationValidationException(@Nullable String field, String message) {
        super(message, false, null);
        this.field = field;
    }

    /** Returns the offending input field, or null when the failure is not field-specific. */
    @Nullable
    public String getField() {
        return field;
    }
}
