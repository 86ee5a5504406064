package net.chapterone.service.reward;

import jakarta.annotation.Nullable;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import net.chapterone.domain.context.ContextVector;
import net.chapterone.domain.reward.ActionType;
import net.chapterone.domain.reward.Identity;
import net.chapterone.domain.reward.Impression;
import net.chapterone.domain.reward.UserAction;
import net.chapterone.exception.RecommendationValidationException;
import net.chapterone.repository.ActionRepository;
import net.chapterone.repository.ImpressionRepository;
import net.chapterone.service.BanditMetrics;
import net.chapterone.service.context.ContextEncoder;
import net.chapterone.util.ValidationUtils;
import org.springframework.stereotype.Service;

/**
 * Durably records impressions and user actions. Recording never waits on learning; attribution picks
 * the records up later.
 */
@Slf4j
@Service
public class RewardSignalRecorder {

    private final ImpressionRepository impressionRepository;
    private final ActionRepository actionRepository;
    private final BanditMetrics metrics;
    private final Clock clock;

    public RewardSignalRecorder(ImpressionRepository impressionRepository, ActionRepository actionRepository,
                                BanditMetrics metrics, Clock clock) {
        this.impressionRepository = impressionRepository;
        this.actionRepository = actionRepository;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Records that {@code bookId} was shown at {@code rank} by {@code armId}.
     *
     * @return the new impression id
     * @throws RecommendationValidationException when a required field is missing or out of range
     */
    public UUID recordImpression(Identity identity, String bookId, ContextVector context, String armId,
                                 int rank, double score, @Nullable Map<String, String> metadata) {
        requireText("bookId", bookId);
        requireText("armId", armId);
        if (identity == null) {
            throw new RecommendationValidationException("identity", "identity is required");
        }
        if (context == null || context.dimension() != ContextEncoder.DIMENSION) {
            throw new RecommendationValidationException("context",
                "context vector must have " + ContextEncoder.DIMENSION + " dimensions");
        }
        if (rank < 1) {
            throw new RecommendationValidationException("rank", "rank must be 1 or greater");
        }
        UUID impressionId = UUID.randomUUID();
        impressionRepository.save(new Impression(impressionId, identity, bookId.trim(), context, armId, rank,
            ValidationUtils.isFinite(score) ? score : 0.0, metadata, clock.instant(), null, null));
        metrics.incrementImpressionsRecorded(1);
        return impressionId;
    }

    /**
     * Records a user action. Every call writes a new row; repeated actions are all kept.
     *
     * @param timestamp when the action happened, now when null
     * @throws RecommendationValidationException for a missing book, a rating outside 1 to 5 or a negative dwell time
     */
    public ActionAck recordAction(Identity identity, String bookId, ActionType actionType,
                                  @Nullable Double actionValue, @Nullable Instant timestamp) {
        if (identity == null) {
            throw new RecommendationValidationException("identity", "identity is required");
        }
        requireText("bookId", bookId);
        if (actionType == null) {
            throw new RecommendationValidationException("actionType", "actionType is required");
        }
        validateValue(actionType, actionValue);

        Instant createdAt = timestamp == null ? clock.instant() : timestamp;
        UserAction action = UserAction.unattributed(UUID.randomUUID(), identity, bookId.trim(), actionType,
            actionValue, createdAt);
        actionRepository.save(action);
        metrics.incrementActionsRecorded();
        log.debug("Recorded {} on book {} for {}", actionType.value(), action.bookId(), identity);
        return new ActionAck(action.actionId(), createdAt);
    }

    public static void validateValue(ActionType actionType, @Nullable Double actionValue) {
        if (actionValue != null && !ValidationUtils.isFinite(actionValue)) {
            throw new RecommendationValidationException("actionValue", "actionValue must be a finite number");
        }
        if (actionType == ActionType.RATE) {
            if (actionValue == null) {
                throw new RecommendationValidationException("actionValue", "rate requires a rating value");
            }
            if (actionValue < RewardPolicy.MIN_RATING || actionValue > RewardPolicy.MAX_RATING) {
                throw new RecommendationValidationException("actionValue",
                    "rating must be between 1 and 5, got " + actionValue);
            }
        }
        if (actionType == ActionType.VIEW && actionValue != null && actionValue < 0) {
            throw new RecommendationValidationException("actionValue", "view duration must be non-negative");
        }
    }

    private static void requireText(String field, String value) {
        if (!ValidationUtils.hasText(value)) {
            throw new RecommendationValidationException(field, field + " is required");
        }
    }

    /**
     * Acknowledgement of a durably recorded action.
     */
    public record ActionAck(UUID actionId, Instant recordedAt) {
    }
}
