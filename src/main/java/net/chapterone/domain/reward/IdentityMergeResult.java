package net.chapterone.domain.reward;

/**
 * Rows reassigned from an anonymous session to a user.
 */
public record IdentityMergeResult(String sessionId, String userId, int impressionsMerged, int actionsMerged) {
}
