package net.chapterone.domain.reward;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.UUID;

/**
 * A reader action on a book. Content is immutable; the attribution marker is written once.
 */
public record UserAction(
    UUID actionId,
    Identity identity,
    String bookId,
    ActionType actionType,
    @Nullable Double actionValue,
    Instant createdAt,
    @Nullable Instant attributedAt,
    @Nullable UUID attributedImpressionId
) {

    public static UserAction unattributed(UUID actionId, Identity identity, String bookId, ActionType actionType,
                                          @Nullable Double actionValue, Instant createdAt) {
        return new UserAction(actionId, identity, bookId, actionType, actionValue, createdAt, null, null);
    }

    public boolean isAttributed() {
        return attributedAt != null;
    }

    public UserAction withIdentity(Identity newIdentity) {
        return new UserAction(actionId, newIdentity, bookId, actionType, actionValue, createdAt,
            attributedAt, attributedImpressionId);
    }

    public UserAction markedAttributed(UUID impressionId, Instant at) {
        return new UserAction(actionId, identity, bookId, actionType, actionValue, createdAt, at, impressionId);
    }
}
