package net.chapterone.service.strategy;

import com.github.benmanes.caffeine.cache.Cache;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.chapterone.config.CacheFactory;
import net.chapterone.config.RecommendationProperties;
import net.chapterone.domain.bandit.BanditArm;
import net.chapterone.domain.catalog.RankedBook;
import net.chapterone.domain.reward.UserAction;
import net.chapterone.repository.ActionRepository;
import net.chapterone.service.reward.RewardPolicy;
import org.springframework.stereotype.Component;

/**
 * Trending arm: positive reward points earned by each book over the last week, plus a small share of
 * its catalog popularity. The point totals are cached briefly and shared across requests.
 */
@Component
public class TrendingPopularStrategy implements RecommendationStrategy {

    static final Duration TRENDING_WINDOW = Duration.ofDays(7);
    static final double POPULARITY_WEIGHT = 0.1;
    private static final int MAX_ACTIONS_SCANNED = 20_000;
    private static final String SNAPSHOT_KEY = "trending";

    private final ActionRepository actionRepository;
    private final RewardPolicy rewardPolicy;
    private final Clock clock;
    private final Cache<String, Map<String, Double>> trendingCache;

    public TrendingPopularStrategy(ActionRepository actionRepository, RewardPolicy rewardPolicy, Clock clock,
                                   CacheFactory cacheFactory, RecommendationProperties properties) {
        this.actionRepository = actionRepository;
        this.rewardPolicy = rewardPolicy;
        this.clock = clock;
        this.trendingCache = cacheFactory.createCache("trendingPoints", 1, properties.getPopularityCacheTtl());
    }

    @Override
    public BanditArm arm() {
        return BanditArm.TRENDING_POPULAR;
    }

    @Override
    public List<RankedBook> rank(StrategyRequest request) {
        Map<String, Double> points = trendingCache.get(SNAPSHOT_KEY, ignored -> loadTrendingPoints());
        return RankingSupport.rank(request.candidates(),
            candidate -> points.getOrDefault(candidate.bookId(), 0.0) + POPULARITY_WEIGHT * candidate.popularityScore(),
            "trending", request.limit());
    }

    private Map<String, Double> loadTrendingPoints() {
        Map<String, Double> points = new HashMap<>();
        for (UserAction action : actionRepository.findSince(clock.instant().minus(TRENDING_WINDOW), MAX_ACTIONS_SCANNED)) {
            double value = rewardPolicy.points(action.actionType(), action.actionValue());
            if (value > 0) {
                points.merge(action.bookId(), value, Double::sum);
            }
        }
        return Map.copyOf(points);
    }
}
