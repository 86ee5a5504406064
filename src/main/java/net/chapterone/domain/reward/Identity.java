package net.chapterone.domain.reward;

import jakarta.annotation.Nullable;
import net.chapterone.exception.RecommendationValidationException;
import net.chapterone.util.ValidationUtils;

/**
 * Who a recommendation was shown to: a signed-in user, an anonymous session, or both.
 *
 * @param userId stable user identifier, null for anonymous readers
 * @param sessionId anonymous session identifier, null when only the user is known
 */
public record Identity(@Nullable String userId, @Nullable String sessionId) {

    public Identity {
        userId = ValidationUtils.trimToNull(userId);
        sessionId = ValidationUtils.trimToNull(sessionId);
        if (userId == null && sessionId == null) {
            throw new RecommendationValidationException("identity", "Either userId or sessionId is required");
        }
    }

    public static Identity user(String userId) {
        return new Identity(userId, null);
    }

    public static Identity session(String sessionId) {
        return new Identity(null, sessionId);
    }

    public boolean hasUser() {
        return userId != null;
    }

    /**
     * Two signed-in identities match only on the same user id. When either side is anonymous they match
     * on a shared session id.
     */
    public boolean matches(Identity other) {
        if (other == null) {
            return false;
        }
        if (userId != null && other.userId != null) {
            return userId.equals(other.userId);
        }
        return sessionId != null && sessionId.equals(other.sessionId);
    }
}
