package net.chapterone.application.identity;

import net.chapterone.domain.reward.IdentityMergeResult;
import net.chapterone.exception.RecommendationValidationException;
import net.chapterone.repository.ActionRepository;
import net.chapterone.repository.ImpressionRepository;
import net.chapterone.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Links an anonymous session to a signed-in user so later actions by the user attribute to
 * impressions shown to the session.
 *
 * <p>Impressions and actions are reassigned in two separate idempotent updates; re-running the merge
 * after a partial failure completes it. Arm models are keyed by scope and are not moved.</p>
 */
@Service
public class IdentityMergeUseCase {

    private static final Logger log = LoggerFactory.getLogger(IdentityMergeUseCase.class);

    private final ImpressionRepository impressionRepository;
    private final ActionRepository actionRepository;

    public IdentityMergeUseCase(ImpressionRepository impressionRepository, ActionRepository actionRepository) {
        this.impressionRepository = impressionRepository;
        this.actionRepository = actionRepository;
    }

    /**
     * Assigns {@code userId} to every impression and action of {@code sessionId} that has no user yet.
     *
     * @throws RecommendationValidationException when either id is blank
     */
    public IdentityMergeResult merge(String sessionId, String userId) {
        String normalizedSession = ValidationUtils.trimToNull(sessionId);
        String normalizedUser = ValidationUtils.trimToNull(userId);
        if (normalizedSession == null) {
            throw new RecommendationValidationException("sessionId", "sessionId is required");
        }
        if (normalizedUser == null) {
            throw new RecommendationValidationException("userId", "userId is required");
        }

        int impressions = impressionRepository.reassignImpressions(normalizedSession, normalizedUser);
        int actions = actionRepository.reassignActions(normalizedSession, normalizedUser);
        log.info("Merged session {} into user {} ({} impressions, {} actions)",
            normalizedSession, normalizedUser, impressions, actions);
        return new IdentityMergeResult(normalizedSession, normalizedUser, impressions, actions);
    }
}
