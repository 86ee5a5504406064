package net.chapterone.service.strategy;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.chapterone.domain.bandit.BanditArm;
import net.chapterone.domain.catalog.RankedBook;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Blends the other arms with reciprocal-rank fusion: a book earns {@code 1 / (K + rank)} from each
 * arm that ranked it.
 */
@Component
public class PersonalizedMixStrategy implements RecommendationStrategy {

    static final int FUSION_K = 60;

    private final List<RecommendationStrategy> components;

    @Autowired
    public PersonalizedMixStrategy(SemanticSimilarityStrategy semantic,
                                   ContextualMoodStrategy mood,
                                   TrendingPopularStrategy trending,
                                   CollaborativeFilteringStrategy collaborative) {
        this(List.of(semantic, mood, trending, collaborative));
    }

    PersonalizedMixStrategy(List<RecommendationStrategy> components) {
        this.components = List.copyOf(components);
    }

    @Override
    public BanditArm arm() {
        return BanditArm.PERSONALIZED_MIX;
    }

    @Override
    public List<RankedBook> rank(StrategyRequest request) {
        StrategyRequest full = new StrategyRequest(request.context(), request.contextVector(), request.candidates(),
            request.identity(), request.candidates().size());
        Map<String, Double> fused = new HashMap<>();
        for (RecommendationStrategy component : components) {
            List<RankedBook> ranked = component.rank(full);
            for (int i = 0; i < ranked.size(); i++) {
                fused.merge(ranked.get(i).bookId(), 1.0 / (FUSION_K + i + 1), Double::sum);
            }
        }
        return RankingSupport.rank(request.candidates(), candidate -> fused.getOrDefault(candidate.bookId(), 0.0),
            "personalized mix", request.limit());
    }
}
