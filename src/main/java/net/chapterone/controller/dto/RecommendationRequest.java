package net.chapterone.controller.dto;

import java.util.List;
import net.chapterone.domain.catalog.BookCandidate;
import net.chapterone.domain.context.ReadingContext;

/**
 * Body of {@code POST /api/recommendations}.
 */
public record RecommendationRequest(
    ReadingContextDto context,
    List<CandidateBookDto> candidateBooks,
    String userId,
    String sessionId,
    Integer limit
) {

    public ReadingContext readingContext() {
        return context == null ? ReadingContext.empty() : context.toDomain();
    }

    /** Candidates as domain objects; null when the client sent none so validation can reject it. */
    public List<BookCandidate> candidates() {
        if (candidateBooks == null) {
            return null;
        }
        return candidateBooks.stream()
            .map(candidate -> candidate == null ? null : candidate.toDomain())
            .toList();
    }
}
