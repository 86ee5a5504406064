package net.chapterone.domain.reward;

import java.util.Locale;
import net.chapterone.exception.RecommendationValidationException;

/**
 * User actions that carry a reward signal for an earlier impression.
 */
public enum ActionType {
    CLICK("click"),
    SAVE("save"),
    UNSAVE("unsave"),
    RATE("rate"),
    VIEW("view"),
    DISMISS("dismiss"),
    SHARE("share");

    private final String value;

    ActionType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolves the wire value of an action type.
     *
     * @throws RecommendationValidationException when the value is blank or unknown
     */
    public static ActionType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new RecommendationValidationException("actionType", "actionType is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ActionType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new RecommendationValidationException("actionType", "Unsupported actionType: " + raw);
    }
}
