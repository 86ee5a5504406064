package net.chapterone.controller.dto;

import java.time.Instant;

/**
 * Body of {@code POST /api/interactions}.
 *
 * @param timestamp when the action happened; server time when absent
 */
public record InteractionRequest(
    String bookId,
    String actionType,
    Double actionValue,
    String userId,
    String sessionId,
    Instant timestamp
) {
}
