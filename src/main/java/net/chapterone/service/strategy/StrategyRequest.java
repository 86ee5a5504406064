package net.chapterone.service.strategy;

import jakarta.annotation.Nullable;
import java.util.List;
import net.chapterone.domain.catalog.BookCandidate;
import net.chapterone.domain.context.ContextVector;
import net.chapterone.domain.context.ReadingContext;
import net.chapterone.domain.reward.Identity;

/**
 * Input shared by every strategy for one selection.
 *
 * @param identity reader, null when neither a user nor a session is known
 */
public record StrategyRequest(
    ReadingContext context,
    ContextVector contextVector,
    List<BookCandidate> candidates,
    @Nullable Identity identity,
    int limit
) {

    public StrategyRequest {
        candidates = List.copyOf(candidates);
    }
}
