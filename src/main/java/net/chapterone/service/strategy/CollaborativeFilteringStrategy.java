package net.chapterone.service.strategy;

import com.github.benmanes.caffeine.cache.Cache;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.chapterone.config.CacheFactory;
import net.chapterone.config.RecommendationProperties;
import net.chapterone.domain.bandit.BanditArm;
import net.chapterone.domain.catalog.RankedBook;
import net.chapterone.domain.reward.Identity;
import net.chapterone.domain.reward.UserAction;
import net.chapterone.repository.ActionRepository;
import net.chapterone.service.reward.RewardPolicy;
import org.springframework.stereotype.Component;

/**
 * Collaborative arm: item co-occurrence. A candidate scores one point for every other reader who
 * engaged positively with both the candidate and at least one book this reader engaged with.
 */
@Component
public class CollaborativeFilteringStrategy implements RecommendationStrategy {

    static final Duration HISTORY_WINDOW = Duration.ofDays(90);
    private static final int MAX_ACTIONS_SCANNED = 50_000;
    private static final String SNAPSHOT_KEY = "coEngagement";

    private final ActionRepository actionRepository;
    private final RewardPolicy rewardPolicy;
    private final Clock clock;
    private final Cache<String, Map<String, Set<String>>> engagementCache;

    public CollaborativeFilteringStrategy(ActionRepository actionRepository, RewardPolicy rewardPolicy, Clock clock,
                                          CacheFactory cacheFactory, RecommendationProperties properties) {
        this.actionRepository = actionRepository;
        this.rewardPolicy = rewardPolicy;
        this.clock = clock;
        this.engagementCache = cacheFactory.createCache("coEngagement", 1, properties.getPopularityCacheTtl());
    }

    @Override
    public BanditArm arm() {
        return BanditArm.COLLABORATIVE_FILTERING;
    }

    @Override
    public List<RankedBook> rank(StrategyRequest request) {
        Map<String, Set<String>> booksByReader = engagementCache.get(SNAPSHOT_KEY, ignored -> loadEngagement());
        Map<String, Double> coOccurrence = request.identity() == null
            ? Map.of()
            : coOccurrence(readerKey(request.identity()), booksByReader);
        return RankingSupport.rank(request.candidates(),
            candidate -> coOccurrence.getOrDefault(candidate.bookId(), 0.0),
            "readers like you", request.limit());
    }

    static Map<String, Double> coOccurrence(String reader, Map<String, Set<String>> booksByReader) {
        Set<String> own = booksByReader.getOrDefault(reader, Set.of());
        if (own.isEmpty()) {
            return Map.of();
        }
        Map<String, Double> scores = new HashMap<>();
        for (Map.Entry<String, Set<String>> entry : booksByReader.entrySet()) {
            if (entry.getKey().equals(reader) || entry.getValue().stream().noneMatch(own::contains)) {
                continue;
            }
            for (String book : entry.getValue()) {
                if (!own.contains(book)) {
                    scores.merge(book, 1.0, Double::sum);
                }
            }
        }
        return scores;
    }

    private Map<String, Set<String>> loadEngagement() {
        Map<String, Set<String>> booksByReader = new HashMap<>();
        for (UserAction action : actionRepository.findSince(clock.instant().minus(HISTORY_WINDOW), MAX_ACTIONS_SCANNED)) {
            if (rewardPolicy.points(action.actionType(), action.actionValue()) > 0) {
                booksByReader.computeIfAbsent(readerKey(action.identity()), ignored -> new HashSet<>())
                    .add(action.bookId());
            }
        }
        return booksByReader;
    }

    static String readerKey(Identity identity) {
        return identity.hasUser() ? "user:" + identity.userId() : "session:" + identity.sessionId();
    }
}
