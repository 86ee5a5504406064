package net.chapterone.service.strategy;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.chapterone.domain.bandit.BanditArm;
import net.chapterone.domain.catalog.BookCandidate;
import net.chapterone.domain.catalog.RankedBook;
import net.chapterone.util.ValidationUtils;
import org.springframework.stereotype.Component;

/**
 * Mood-based arm: ranks candidates by how many of their tags match the context and its keywords.
 * A direct tag match on the mood, situation or goal counts double.
 */
@Component
public class ContextualMoodStrategy implements RecommendationStrategy {

    static final double DIRECT_MATCH_WEIGHT = 2.0;
    static final double KEYWORD_MATCH_WEIGHT = 1.0;

    @Override
    public BanditArm arm() {
        return BanditArm.CONTEXTUAL_MOOD;
    }

    @Override
    public List<RankedBook> rank(StrategyRequest request) {
        Set<String> direct = new HashSet<>();
        for (String value : new String[] {request.context().mood(), request.context().situation(),
            request.context().goal()}) {
            String key = ValidationUtils.normalizeKey(value);
            if (key != null) {
                direct.add(key);
            }
        }
        Set<String> keywords = new HashSet<>(ContextKeywords.keywordsFor(request.context()));

        return RankingSupport.rank(request.candidates(), candidate -> tagScore(candidate, direct, keywords),
            "matches your mood", request.limit());
    }

    static double tagScore(BookCandidate candidate, Set<String> direct, Set<String> keywords) {
        double score = 0.0;
        for (String tag : candidate.tags()) {
            String key = ValidationUtils.normalizeKey(tag);
            if (key == null) {
                continue;
            }
            if (direct.contains(key)) {
                score += DIRECT_MATCH_WEIGHT;
            } else if (keywords.contains(key) || keywords.contains(key.replace('_', ' '))) {
                score += KEYWORD_MATCH_WEIGHT;
            }
        }
        return score;
    }
}
