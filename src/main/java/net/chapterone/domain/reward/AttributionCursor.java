package net.chapterone.domain.reward;

import java.time.Instant;
import java.util.UUID;

/**
 * Keyset position in the unattributed-action scan, ordered by (createdAt, actionId).
 */
public record AttributionCursor(Instant createdAt, UUID actionId) {

    public static AttributionCursor after(UserAction action) {
        return new AttributionCursor(action.createdAt(), action.actionId());
    }

    public boolean precedes(UserAction action) {
        int byTime = createdAt.compareTo(action.createdAt());
        if (byTime != 0) {
            return byTime < 0;
        }
        return actionId.compareTo(action.actionId()) < 0;
    }
}
