package net.chapterone.service.strategy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToDoubleFunction;
import net.chapterone.domain.catalog.BookCandidate;
import net.chapterone.domain.catalog.RankedBook;

/**
 * Ordering helpers shared by the strategies.
 */
public final class RankingSupport {

    /** Non-personalized order: popularity descending, then book id. */
    public static final Comparator<BookCandidate> POPULARITY_ORDER = Comparator
        .comparingDouble(BookCandidate::popularityScore).reversed()
        .thenComparing(BookCandidate::bookId);

    private RankingSupport() {
    }

    /**
     * Scores every candidate and keeps the top {@code limit}; equal scores fall back to popularity order.
     */
    public static List<RankedBook> rank(List<BookCandidate> candidates, ToDoubleFunction<BookCandidate> scorer,
                                        String reason, int limit) {
        List<Scored> scored = new ArrayList<>(candidates.size());
        for (BookCandidate candidate : candidates) {
            scored.add(new Scored(candidate, scorer.applyAsDouble(candidate)));
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed()
            .thenComparing(Scored::candidate, POPULARITY_ORDER));
        List<RankedBook> ranked = new ArrayList<>(Math.min(limit, scored.size()));
        for (Scored entry : scored) {
            if (ranked.size() >= limit) {
                break;
            }
            ranked.add(new RankedBook(entry.candidate().bookId(), entry.score(), reason));
        }
        return ranked;
    }

    /**
     * Non-personalized ranking used when no arm can be selected in time.
     */
    public static List<RankedBook> fallback(List<BookCandidate> candidates, int limit) {
        return rank(candidates, BookCandidate::popularityScore, "popular", limit);
    }

    private record Scored(BookCandidate candidate, double score) {
    }
}
