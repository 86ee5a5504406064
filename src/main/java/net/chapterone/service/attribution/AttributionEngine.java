package net.chapterone.service.attribution;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import net.chapterone.config.AttributionProperties;
import net.chapterone.domain.bandit.ArmKey;
import net.chapterone.domain.reward.AttributionCursor;
import net.chapterone.domain.reward.AttributionResult;
import net.chapterone.domain.reward.Impression;
import net.chapterone.domain.reward.UserAction;
import net.chapterone.exception.AttributionConflictException;
import net.chapterone.exception.RecommendationValidationException;
import net.chapterone.repository.ActionRepository;
import net.chapterone.repository.AttributionLedger;
import net.chapterone.repository.ImpressionRepository;
import net.chapterone.service.BanditMetrics;
import net.chapterone.service.bandit.ArmRegistry;
import net.chapterone.service.bandit.ModelUpdater;
import net.chapterone.service.reward.RewardPolicy;
import net.chapterone.service.reward.RewardSignalRecorder;
import net.chapterone.util.LoggingUtils;
import org.springframework.stereotype.Service;

/**
 * Connects unattributed actions to the impressions that plausibly caused them and feeds the decayed
 * rewards to the arm models.
 *
 * <p>An action is credited to the most recent impression of the same book shown to the same identity
 * no more than the attribution window before it (both ends inclusive). Its reward is
 * {@code points × exp(-λ·Δt)} with Δt in hours. The action's marker, the impression's reward and the arm
 * update commit as one unit, so re-running a batch never counts an action twice and a failed arm
 * update leaves the action for the next run.</p>
 *
 * <p>Actions that match no impression, or are malformed, are marked examined and drop out of later
 * scans; a later identity merge clears the mark. Actions timestamped in the future stay unmarked.</p>
 *
 * <p>The scan pages through actions by (createdAt, actionId) and stops early when the running thread
 * is interrupted. Attributions already committed stay committed; the next run resumes with whatever
 * is still unmarked.</p>
 */
@Slf4j
@Service
public class AttributionEngine {

    /** Impression metadata key holding the arm scope the impression was selected in. */
    public static final String SCOPE_METADATA_KEY = "scope";

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private final ActionRepository actionRepository;
    private final ImpressionRepository impressionRepository;
    private final AttributionLedger ledger;
    private final ModelUpdater modelUpdater;
    private final ArmRegistry armRegistry;
    private final RewardPolicy rewardPolicy;
    private final AttributionProperties properties;
    private final BanditMetrics metrics;
    private final Clock clock;

    public AttributionEngine(ActionRepository actionRepository,
                             ImpressionRepository impressionRepository,
                             AttributionLedger ledger,
                             ModelUpdater modelUpdater,
                             ArmRegistry armRegistry,
                             RewardPolicy rewardPolicy,
                             AttributionProperties properties,
                             BanditMetrics metrics,
                             Clock clock) {
        this.actionRepository = actionRepository;
        this.impressionRepository = impressionRepository;
        this.ledger = ledger;
        this.modelUpdater = modelUpdater;
        this.armRegistry = armRegistry;
        this.rewardPolicy = rewardPolicy;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Attributes every unmarked action recorded in the last {@code windowHours} hours.
     *
     * @param windowHours how far back to scan for unattributed actions
     * @return counts of the run; {@code errors} covers malformed or failing records, which are skipped
     * @throws RecommendationValidationException when {@code windowHours} is not positive
     */
    public AttributionResult attributeRewards(int windowHours) {
        if (windowHours <= 0) {
            throw new RecommendationValidationException("windowHours", "windowHours must be positive");
        }
        long started = System.nanoTime();
        Instant now = clock.instant();
        Instant since = now.minus(Duration.ofHours(windowHours));

        BatchCounters counters = new BatchCounters();
        AttributionCursor cursor = null;
        scan:
        while (counters.processed < properties.getMaxActionsPerRun()) {
            int pageSize = Math.min(properties.getPageSize(), properties.getMaxActionsPerRun() - counters.processed);
            List<UserAction> page = actionRepository.findUnattributed(since, cursor, pageSize);
            if (page.isEmpty()) {
                break;
            }
            for (UserAction action : page) {
                if (Thread.currentThread().isInterrupted()) {
                    counters.interrupted = true;
                    break scan;
                }
                counters.processed++;
                cursor = AttributionCursor.after(action);
                attributeOne(action, now, counters);
            }
            if (page.size() < pageSize) {
                break;
            }
        }

        AttributionResult result = counters.toResult();
        log.info("Attribution batch over {}h: processed={}, updated={}, errors={}, unmatched={}, conflicts={}, interrupted={} ({} ms)",
            windowHours, result.processed(), result.updated(), result.errors(), result.unmatched(),
            result.conflicts(), result.interrupted(), (System.nanoTime() - started) / 1_000_000);
        return result;
    }

    private void attributeOne(UserAction action, Instant now, BatchCounters counters) {
        try {
            if (action.createdAt() != null && action.createdAt().isAfter(now)) {
                throw new RecommendationValidationException("Action " + action.actionId() + " is timestamped in the future");
            }
            try {
                validate(action);
            } catch (RecommendationValidationException ex) {
                actionRepository.markExamined(action.actionId(), now);
                throw ex;
            }
            Optional<Impression> match = impressionRepository.findLatestAttributable(action.identity(),
                action.bookId(), action.createdAt().minus(properties.getWindow()), action.createdAt());
            if (match.isEmpty()) {
                actionRepository.markExamined(action.actionId(), now);
                counters.unmatched++;
                return;
            }
            Impression impression = match.get();
            double hours = Duration.between(impression.createdAt(), action.createdAt()).toMillis() / MILLIS_PER_HOUR;
            double reward = RewardPolicy.decay(rewardPolicy.points(action.actionType(), action.actionValue()),
                properties.getDecayPerHour(), hours);

            if (!commit(action, impression, reward, now)) {
                AttributionConflictException conflict = new AttributionConflictException(action.actionId());
                log.warn("{}; skipping", conflict.getMessage());
                metrics.incrementAttributionConflicts();
                counters.conflicts++;
                return;
            }
            metrics.incrementAttributionApplied();
            counters.updated++;
        } catch (RuntimeException ex) {
            LoggingUtils.warn(log, ex, "Skipping action {} during attribution", action.actionId());
            metrics.incrementAttributionErrors();
            counters.errors++;
        }
    }

    /**
     * Commits the attribution together with the arm update. When the ledger fails after the arm was
     * updated in memory, the arm is evicted so its next reference reloads the persisted state.
     */
    private boolean commit(UserAction action, Impression impression, double reward, Instant now) {
        ArmKey key = armKeyOf(impression);
        AtomicBoolean applied = new AtomicBoolean();
        try {
            return ledger.commitAttribution(action.actionId(), impression.impressionId(), reward, now, () -> {
                modelUpdater.applyReward(key, impression.context(), reward);
                applied.set(true);
            });
        } catch (RuntimeException ex) {
            if (applied.get()) {
                armRegistry.evict(key);
            }
            throw ex;
        }
    }

    private ArmKey armKeyOf(Impression impression) {
        String scope = impression.metadata().get(SCOPE_METADATA_KEY);
        if (scope == null || scope.isBlank()) {
            scope = armRegistry.scopeFor(impression.identity().userId());
        }
        return new ArmKey(scope, impression.armId());
    }

    private static void validate(UserAction action) {
        if (action.identity() == null || action.bookId() == null || action.bookId().isBlank()
            || action.actionType() == null || action.createdAt() == null) {
            throw new RecommendationValidationException("Malformed action record " + action.actionId());
        }
        RewardSignalRecorder.validateValue(action.actionType(), action.actionValue());
    }

    private static final class BatchCounters {
        private int processed;
        private int updated;
        private int errors;
        private int unmatched;
        private int conflicts;
        private boolean interrupted;

        private AttributionResult toResult() {
            return new AttributionResult(processed, updated, errors, unmatched, conflicts, interrupted);
        }
    }
}
