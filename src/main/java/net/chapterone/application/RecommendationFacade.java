package net.chapterone.application;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import net.chapterone.application.identity.IdentityMergeUseCase;
import net.chapterone.application.recommendation.SelectRecommendationUseCase;
import net.chapterone.application.recommendation.SelectRecommendationUseCase.RecommendationResult;
import net.chapterone.application.recommendation.SelectRecommendationUseCase.SelectionCommand;
import net.chapterone.config.AttributionProperties;
import net.chapterone.config.SimilarityProperties;
import net.chapterone.domain.bandit.BanditStatistics;
import net.chapterone.domain.catalog.BookCandidate;
import net.chapterone.domain.context.ReadingContext;
import net.chapterone.domain.reward.ActionType;
import net.chapterone.domain.reward.AttributionResult;
import net.chapterone.domain.reward.EngagementReport;
import net.chapterone.domain.reward.Identity;
import net.chapterone.domain.reward.IdentityMergeResult;
import net.chapterone.domain.reward.RewardSignal;
import net.chapterone.domain.reward.UserAction;
import net.chapterone.exception.ResourceNotFoundException;
import net.chapterone.service.attribution.AttributionEngine;
import net.chapterone.service.bandit.ArmRegistry;
import net.chapterone.service.bandit.BanditStatsAggregator;
import net.chapterone.service.reward.RewardSignalQueryService;
import net.chapterone.service.reward.RewardSignalRecorder;
import net.chapterone.service.reward.RewardSignalRecorder.ActionAck;
import net.chapterone.service.similarity.SemanticSimilarityEngine;
import net.chapterone.service.similarity.SimilarityIndexService;
import net.chapterone.service.similarity.SimilarityIndexService.IndexRefreshSummary;
import net.chapterone.service.similarity.SimilarityMatch;
import net.chapterone.util.ValidationUtils;
import org.springframework.stereotype.Component;

/**
 * In-process entry point of the recommendation core. Controllers and schedulers call through here;
 * the facade only normalizes inputs and delegates.
 */
@Component
public class RecommendationFacade {

    private static final int DEFAULT_SIGNAL_HOURS = 168;
    private static final int DEFAULT_ENGAGEMENT_HOURS = 24;

    private final SelectRecommendationUseCase selectRecommendationUseCase;
    private final RewardSignalRecorder rewardSignalRecorder;
    private final AttributionEngine attributionEngine;
    private final BanditStatsAggregator statsAggregator;
    private final IdentityMergeUseCase identityMergeUseCase;
    private final SimilarityIndexService similarityIndexService;
    private final SemanticSimilarityEngine similarityEngine;
    private final ArmRegistry armRegistry;
    private final RewardSignalQueryService rewardSignalQueryService;
    private final AttributionProperties attributionProperties;
    private final SimilarityProperties similarityProperties;

    public RecommendationFacade(SelectRecommendationUseCase selectRecommendationUseCase,
                                RewardSignalRecorder rewardSignalRecorder,
                                AttributionEngine attributionEngine,
                                BanditStatsAggregator statsAggregator,
                                IdentityMergeUseCase identityMergeUseCase,
                                SimilarityIndexService similarityIndexService,
                                SemanticSimilarityEngine similarityEngine,
                                ArmRegistry armRegistry,
                                RewardSignalQueryService rewardSignalQueryService,
                                AttributionProperties attributionProperties,
                                SimilarityProperties similarityProperties) {
        this.selectRecommendationUseCase = selectRecommendationUseCase;
        this.rewardSignalRecorder = rewardSignalRecorder;
        this.attributionEngine = attributionEngine;
        this.statsAggregator = statsAggregator;
        this.identityMergeUseCase = identityMergeUseCase;
        this.similarityIndexService = similarityIndexService;
        this.similarityEngine = similarityEngine;
        this.armRegistry = armRegistry;
        this.rewardSignalQueryService = rewardSignalQueryService;
        this.attributionProperties = attributionProperties;
        this.similarityProperties = similarityProperties;
    }

    public RecommendationResult selectRecommendation(@Nullable ReadingContext context,
                                                     List<BookCandidate> candidateBooks,
                                                     @Nullable String userId) {
        return selectRecommendation(context, candidateBooks, userId, null, null, true);
    }

    /**
     * Selects and ranks books for the reader.
     *
     * @param personalized false returns the popularity ranking without consulting the bandit
     */
    public RecommendationResult selectRecommendation(@Nullable ReadingContext context,
                                                     List<BookCandidate> candidateBooks,
                                                     @Nullable String userId,
                                                     @Nullable String sessionId,
                                                     @Nullable Integer limit,
                                                     boolean personalized) {
        return selectRecommendationUseCase.select(
            new SelectionCommand(context, candidateBooks, userId, sessionId, limit, personalized));
    }

    /**
     * Records a reader action against a book. The action is attributed by the next batch run.
     *
     * @throws net.chapterone.exception.RecommendationValidationException for an unknown action type,
     *         a missing identity or an out-of-range value
     */
    public ActionAck recordInteraction(String bookId, String actionType, @Nullable Double actionValue,
                                       @Nullable String userId, @Nullable String sessionId) {
        return recordInteraction(bookId, actionType, actionValue, userId, sessionId, null);
    }

    public ActionAck recordInteraction(String bookId, String actionType, @Nullable Double actionValue,
                                       @Nullable String userId, @Nullable String sessionId,
                                       @Nullable Instant timestamp) {
        ActionType type = ActionType.fromValue(actionType);
        return rewardSignalRecorder.recordAction(new Identity(userId, sessionId), bookId, type, actionValue, timestamp);
    }

    /**
     * Runs one attribution batch.
     *
     * @param windowHours how far back to scan for unattributed actions; the configured default when null
     */
    public AttributionResult runAttributionBatch(@Nullable Integer windowHours) {
        int hours = windowHours == null ? attributionProperties.getDefaultWindowHours() : windowHours;
        return attributionEngine.attributeRewards(hours);
    }

    public BanditStatistics getArmStatistics(@Nullable String userId) {
        return statsAggregator.getArmStatistics(userId);
    }

    /**
     * Rewarded impressions of the reader, newest first.
     *
     * @param hoursBack how far back to look; one week when null
     */
    public List<RewardSignal> getRewardSignals(@Nullable String userId, @Nullable String sessionId,
                                               @Nullable Integer hoursBack) {
        return rewardSignalQueryService.getRewardSignals(new Identity(userId, sessionId),
            hoursBack == null ? DEFAULT_SIGNAL_HOURS : hoursBack);
    }

    /**
     * Per-arm click-through, save and conversion rates of the reader.
     *
     * @param hoursBack how far back to look; one day when null
     */
    public EngagementReport getArmEngagement(@Nullable String userId, @Nullable String sessionId,
                                             @Nullable Integer hoursBack) {
        return rewardSignalQueryService.getArmEngagement(new Identity(userId, sessionId),
            hoursBack == null ? DEFAULT_ENGAGEMENT_HOURS : hoursBack);
    }

    /**
     * @throws ResourceNotFoundException when no action has that id
     */
    public UserAction getInteraction(UUID actionId) {
        return rewardSignalQueryService.findAction(actionId)
            .orElseThrow(() -> new ResourceNotFoundException("interaction", String.valueOf(actionId)));
    }

    public IdentityMergeResult mergeIdentities(String sessionId, String userId) {
        return identityMergeUseCase.merge(sessionId, userId);
    }

    public IndexRefreshSummary rebuildSimilarityIndex() {
        return similarityIndexService.rebuildFromCatalog();
    }

    /**
     * Books whose text is closest to an indexed book, excluding the book itself.
     *
     * @param threshold minimum cosine similarity; the configured default when null
     * @throws ResourceNotFoundException when the book is not in the similarity index
     */
    public List<SimilarityMatch> findSimilarBooks(String bookId, int limit, @Nullable Double threshold) {
        String normalized = ValidationUtils.trimToNull(bookId);
        if (normalized == null || similarityEngine.currentIndex().vectorOf(normalized).isEmpty()) {
            throw new ResourceNotFoundException("book", bookId);
        }
        double minimum = threshold == null ? similarityProperties.getDefaultThreshold() : threshold;
        return similarityEngine.similarTo(normalized, limit, minimum);
    }

    /**
     * Resets arm models back to the prior.
     *
     * @param userId scope to reset; every scope when null
     * @return persisted arms removed
     */
    public int resetArms(@Nullable String userId) {
        if (ValidationUtils.hasText(userId)) {
            return armRegistry.resetScope(armRegistry.scopeFor(userId));
        }
        return armRegistry.resetAll();
    }
}
