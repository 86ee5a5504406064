package net.chapterone.service.reward;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import net.chapterone.domain.reward.ActionType;
import net.chapterone.domain.reward.ArmEngagement;
import net.chapterone.domain.reward.EngagementReport;
import net.chapterone.domain.reward.Identity;
import net.chapterone.domain.reward.Impression;
import net.chapterone.domain.reward.RewardSignal;
import net.chapterone.domain.reward.UserAction;
import net.chapterone.exception.RecommendationValidationException;
import net.chapterone.repository.ActionRepository;
import net.chapterone.repository.ImpressionRepository;
import org.springframework.stereotype.Service;

/**
 * Read side of the reward signals: what a reader's impressions earned and how each arm engaged them.
 */
@Slf4j
@Service
public class RewardSignalQueryService {

    static final int MAX_RECORDS = 1_000;

    private final ImpressionRepository impressionRepository;
    private final ActionRepository actionRepository;
    private final Clock clock;

    public RewardSignalQueryService(ImpressionRepository impressionRepository, ActionRepository actionRepository,
                                    Clock clock) {
        this.impressionRepository = impressionRepository;
        this.actionRepository = actionRepository;
        this.clock = clock;
    }

    /**
     * Rewarded impressions shown to the identity in the last {@code hoursBack} hours, newest first.
     */
    public List<RewardSignal> getRewardSignals(Identity identity, int hoursBack) {
        Instant since = since(hoursBack);
        return impressionRepository.findRecentForIdentity(identity, since, MAX_RECORDS).stream()
            .filter(impression -> impression.reward() != null)
            .map(RewardSignal::of)
            .toList();
    }

    /**
     * Per-arm impressions, attributed actions and rates for the identity over the last {@code hoursBack} hours.
     *
     * <p>An action counts toward the arm of the impression it was attributed to, provided that impression
     * was shown inside the range.</p>
     */
    public EngagementReport getArmEngagement(Identity identity, int hoursBack) {
        Instant to = clock.instant();
        Instant since = since(hoursBack);
        List<Impression> impressions = impressionRepository.findRecentForIdentity(identity, since, MAX_RECORDS);
        Map<UUID, Impression> byId = new HashMap<>();
        Map<String, Tally> tallies = new TreeMap<>();
        for (Impression impression : impressions) {
            byId.put(impression.impressionId(), impression);
            Tally tally = tallies.computeIfAbsent(impression.armId(), ignored -> new Tally());
            tally.impressions++;
            tally.reward += impression.reward() == null ? 0.0 : impression.reward();
        }

        for (UserAction action : actionRepository.findForIdentity(identity, since, MAX_RECORDS)) {
            if (!action.isAttributed() || action.actionType() == null) {
                continue;
            }
            Optional<Impression> impression = Optional.ofNullable(byId.get(action.attributedImpressionId()))
                .or(() -> impressionRepository.findImpressionById(action.attributedImpressionId()))
                .filter(candidate -> !candidate.createdAt().isBefore(since));
            impression.ifPresent(shown -> tallies.computeIfAbsent(shown.armId(), ignored -> new Tally()).count(action));
        }

        List<ArmEngagement> arms = tallies.entrySet().stream()
            .map(entry -> entry.getValue().toEngagement(entry.getKey()))
            .toList();
        log.debug("Engagement for {} over {}h: {} impressions across {} arms", identity, hoursBack,
            impressions.size(), arms.size());
        return new EngagementReport(since, to, hoursBack, arms);
    }

    /**
     * @return the recorded action, with its attribution marker when it has been attributed
     */
    public Optional<UserAction> findAction(UUID actionId) {
        return actionRepository.findActionById(actionId);
    }

    private Instant since(int hoursBack) {
        if (hoursBack <= 0) {
            throw new RecommendationValidationException("hoursBack", "hoursBack must be positive");
        }
        return clock.instant().minus(Duration.ofHours(hoursBack));
    }

    private static final class Tally {
        private int impressions;
        private int attributed;
        private int clicks;
        private int saves;
        private int ratings;
        private double reward;

        private void count(UserAction action) {
            attributed++;
            if (action.actionType() == ActionType.CLICK) {
                clicks++;
            } else if (action.actionType() == ActionType.SAVE) {
                saves++;
            } else if (action.actionType() == ActionType.RATE) {
                ratings++;
            }
        }

        private ArmEngagement toEngagement(String armId) {
            return new ArmEngagement(armId, impressions, attributed, clicks, saves, ratings,
                rate(clicks), rate(saves), rate(saves + ratings), reward);
        }

        private double rate(int count) {
            return impressions == 0 ? 0.0 : (double) count / impressions;
        }
    }
}
