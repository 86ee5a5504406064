package net.chapterone.controller.dto;

/** Body of {@code POST /api/identities/merge}. */
public record IdentityMergeRequest(String sessionId, String userId) {
}
