package net.chapterone.exception;

import java.util.UUID;

/**
 * An action was already attributed by a concurrent or earlier batch.
 * Handled as a no-op; the reward is never applied twice.
 */
public class AttributionConflictException extends RecommendationCoreException {
    private final UUID actionId;

    public AttributionConflictException(UUID actionId) {
        super("Action " + actionId + " is already attributed", true, null);
        this.actionId = actionId;
    }

    public UUID getActionId() {
        return actionId;
    }
}
