package net.chapterone.service.strategy;

import java.util.ArrayList;
import java.util.List;
import net.chapterone.domain.bandit.BanditArm;
import net.chapterone.domain.catalog.BookCandidate;
import net.chapterone.domain.catalog.RankedBook;
import net.chapterone.domain.context.ReadingContext;
import net.chapterone.service.context.ContextEncoder;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PersonalizedMixStrategyTest {

    private static final List<BookCandidate> CANDIDATES = List.of(
        new BookCandidate("a", null, null, List.of(), 1.0),
        new BookCandidate("b", null, null, List.of(), 2.0),
        new BookCandidate("c", null, null, List.of(), 3.0)
    );

    @Test
    void should_FuseReciprocalRanks_When_ComponentsDisagree() {
        PersonalizedMixStrategy mix = new PersonalizedMixStrategy(List.of(
            fixed(BanditArm.SEMANTIC_SIMILARITY, "a", "b", "c"),
            fixed(BanditArm.CONTEXTUAL_MOOD, "b", "a"),
            fixed(BanditArm.TRENDING_POPULAR, "b")
        ));
        ReadingContext context = ReadingContext.empty();

        List<RankedBook> ranked = mix.rank(new StrategyRequest(context, new ContextEncoder().encode(context),
            CANDIDATES, null, 2));

        assertThat(ranked).extracting(RankedBook::bookId).containsExactly("b", "a");
        assertThat(ranked.get(0).score()).isCloseTo(1.0 / 62 + 2.0 / 61, within(1e-12));
        assertThat(ranked.get(1).score()).isCloseTo(1.0 / 61 + 1.0 / 62, within(1e-12));
    }

    @Test
    void should_AskComponentsForEveryCandidate_When_LimitIsSmaller() {
        List<Integer> limitsSeen = new ArrayList<>();
        RecommendationStrategy recording = new RecommendationStrategy() {
            @Override
            public BanditArm arm() {
                return BanditArm.SEMANTIC_SIMILARITY;
            }

            @Override
            public List<RankedBook> rank(StrategyRequest request) {
                limitsSeen.add(request.limit());
                return List.of();
            }
        };
        ReadingContext context = ReadingContext.empty();

        List<RankedBook> ranked = new PersonalizedMixStrategy(List.of(recording))
            .rank(new StrategyRequest(context, new ContextEncoder().encode(context), CANDIDATES, null, 1));

        assertThat(limitsSeen).containsExactly(3);
        assertThat(ranked).extracting(RankedBook::bookId).containsExactly("c");
    }

    private static RecommendationStrategy fixed(BanditArm arm, String... order) {
        return new RecommendationStrategy() {
            @Override
            public BanditArm arm() {
                return arm;
            }

            @Override
            public List<RankedBook> rank(StrategyRequest request) {
                List<RankedBook> ranked = new ArrayList<>();
                for (int i = 0; i < order.length; i++) {
                    ranked.add(new RankedBook(order[i], order.length - i, "fixed"));
                }
                return ranked;
            }
        };
    }
}
