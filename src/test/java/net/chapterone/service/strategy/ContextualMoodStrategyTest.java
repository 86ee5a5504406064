package net.chapterone.service.strategy;

import java.util.List;
import java.util.Set;
import net.chapterone.domain.catalog.BookCandidate;
import net.chapterone.domain.catalog.RankedBook;
import net.chapterone.domain.context.ContextVector;
import net.chapterone.domain.context.ReadingContext;
import net.chapterone.service.context.ContextEncoder;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContextualMoodStrategyTest {

    private final ContextualMoodStrategy strategy = new ContextualMoodStrategy();

    @Test
    void should_WeighDirectMatchesDouble_When_ScoringTags() {
        BookCandidate candidate = new BookCandidate("b1", null, null,
            List.of("Relaxed", "calm", "Nature", "thriller"), 1.0);

        double score = ContextualMoodStrategy.tagScore(candidate, Set.of("relaxed"), Set.of("calm", "nature"));

        assertThat(score).isEqualTo(4.0);
    }

    @Test
    void should_MatchUnderscoredTags_When_KeywordHasSpace() {
        BookCandidate candidate = new BookCandidate("b1", null, null, List.of("self-help"), 1.0);

        assertThat(ContextualMoodStrategy.tagScore(candidate, Set.of(), Set.of("self help"))).isEqualTo(1.0);
    }

    @Test
    void should_RankMatchingBooksFirst_When_ContextGiven() {
        ReadingContext context = new ReadingContext("adventurous", "vacation", "escape", "evening");
        ContextVector vector = new ContextEncoder().encode(context);
        List<BookCandidate> candidates = List.of(
            new BookCandidate("ledger", "Accounting Basics", null, List.of("business"), 80.0),
            new BookCandidate("odyssey", "The Odyssey", null, List.of("adventure", "journey", "classic"), 20.0),
            new BookCandidate("hobbit", "The Hobbit", null, List.of("fantasy", "adventurous"), 50.0)
        );

        List<RankedBook> ranked = strategy.rank(new StrategyRequest(context, vector, candidates, null, 3));

        // hobbit: adventurous (2) + fantasy (1); odyssey: adventure (1) + journey (1)
        assertThat(ranked).extracting(RankedBook::bookId).containsExactly("hobbit", "odyssey", "ledger");
        assertThat(ranked.get(2).score()).isZero();
    }
}
