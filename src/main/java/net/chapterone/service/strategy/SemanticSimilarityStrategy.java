package net.chapterone.service.strategy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.chapterone.config.SimilarityProperties;
import net.chapterone.domain.bandit.BanditArm;
import net.chapterone.domain.catalog.BookCandidate;
import net.chapterone.domain.catalog.RankedBook;
import net.chapterone.domain.reward.ActionType;
import net.chapterone.domain.reward.UserAction;
import net.chapterone.repository.ActionRepository;
import net.chapterone.service.similarity.SemanticSimilarityEngine;
import org.springframework.stereotype.Component;

/**
 * Content-based arm: TF-IDF similarity of each candidate to the context keywords, blended with its
 * similarity to books the reader recently saved or rated well.
 */
@Component
public class SemanticSimilarityStrategy implements RecommendationStrategy {

    static final double CONTEXT_WEIGHT = 0.6;
    static final double HISTORY_WEIGHT = 0.4;
    private static final Duration HISTORY_LOOKBACK = Duration.ofDays(90);
    private static final int HISTORY_LIMIT = 20;

    private final SemanticSimilarityEngine engine;
    private final ActionRepository actionRepository;
    private final SimilarityProperties properties;
    private final Clock clock;

    public SemanticSimilarityStrategy(SemanticSimilarityEngine engine, ActionRepository actionRepository,
                                      SimilarityProperties properties, Clock clock) {
        this.engine = engine;
        this.actionRepository = actionRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public BanditArm arm() {
        return BanditArm.SEMANTIC_SIMILARITY;
    }

    @Override
    public List<RankedBook> rank(StrategyRequest request) {
        List<String> candidateIds = request.candidates().stream().map(BookCandidate::bookId).toList();
        Map<String, Double> contextScores = engine.scoreBooks(ContextKeywords.queryText(request.context()), candidateIds);
        List<String> likedBooks = likedBooks(request);
        double threshold = properties.getDefaultThreshold();

        return RankingSupport.rank(request.candidates(), candidate -> {
            double contextScore = contextScores.getOrDefault(candidate.bookId(), 0.0);
            double historyScore = 0.0;
            for (String liked : likedBooks) {
                if (!liked.equals(candidate.bookId())) {
                    historyScore = Math.max(historyScore, engine.similarity(liked, candidate.bookId()));
                }
            }
            double score = likedBooks.isEmpty()
                ? contextScore
                : CONTEXT_WEIGHT * contextScore + HISTORY_WEIGHT * historyScore;
            return score >= threshold ? score : 0.0;
        }, "similar content", request.limit());
    }

    private List<String> likedBooks(StrategyRequest request) {
        if (request.identity() == null) {
            return List.of();
        }
        Instant since = clock.instant().minus(HISTORY_LOOKBACK);
        Set<String> liked = new LinkedHashSet<>();
        for (UserAction action : actionRepository.findForIdentity(request.identity(), since, HISTORY_LIMIT)) {
            if (isPositive(action)) {
                liked.add(action.bookId());
            }
        }
        return new ArrayList<>(liked);
    }

    private static boolean isPositive(UserAction action) {
        return action.actionType() == ActionType.SAVE
            || action.actionType() == ActionType.SHARE
            || (action.actionType() == ActionType.RATE && action.actionValue() != null && action.actionValue() >= 4.0);
    }
}
