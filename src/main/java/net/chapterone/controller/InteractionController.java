/**
 * REST controller recording reader interactions.
 *
 * Features:
 * - Records clicks, saves, ratings and other actions for later attribution
 * - Links an anonymous session to a signed-in user
 * - Reports the reward signals and per-arm engagement a reader produced
 */
package net.chapterone.controller;

import java.util.List;
import java.util.UUID;
import net.chapterone.application.RecommendationFacade;
import net.chapterone.controller.dto.IdentityMergeRequest;
import net.chapterone.controller.dto.InteractionRequest;
import net.chapterone.domain.reward.EngagementReport;
import net.chapterone.domain.reward.IdentityMergeResult;
import net.chapterone.domain.reward.RewardSignal;
import net.chapterone.domain.reward.UserAction;
import net.chapterone.exception.RecommendationValidationException;
import net.chapterone.service.reward.RewardSignalRecorder.ActionAck;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class InteractionController {

    private final RecommendationFacade recommendationFacade;

    public InteractionController(RecommendationFacade recommendationFacade) {
        this.recommendationFacade = recommendationFacade;
    }

    /**
     * Records one reader action.
     *
     * @return 202 with the action id; rewards are applied by the next attribution run
     */
    @PostMapping("/interactions")
    public ResponseEntity<ActionAck> recordInteraction(@RequestBody InteractionRequest request) {
        if (request == null) {
            throw new RecommendationValidationException("body", "request body is required");
        }
        ActionAck ack = recommendationFacade.recordInteraction(
            request.bookId(),
            request.actionType(),
            request.actionValue(),
            request.userId(),
            request.sessionId(),
            request.timestamp()
        );
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ack);
    }

    @GetMapping("/interactions/{actionId}")
    public ResponseEntity<UserAction> getInteraction(@PathVariable UUID actionId) {
        return ResponseEntity.ok(recommendationFacade.getInteraction(actionId));
    }

    /**
     * Rewarded impressions of a reader, newest first.
     */
    @GetMapping("/rewards/signals")
    public ResponseEntity<List<RewardSignal>> rewardSignals(
            @RequestParam(name = "userId", required = false) String userId,
            @RequestParam(name = "sessionId", required = false) String sessionId,
            @RequestParam(name = "hoursBack", required = false) Integer hoursBack) {
        return ResponseEntity.ok(recommendationFacade.getRewardSignals(userId, sessionId, hoursBack));
    }

    @GetMapping("/rewards/engagement")
    public ResponseEntity<EngagementReport> armEngagement(
            @RequestParam(name = "userId", required = false) String userId,
            @RequestParam(name = "sessionId", required = false) String sessionId,
            @RequestParam(name = "hoursBack", required = false) Integer hoursBack) {
        return ResponseEntity.ok(recommendationFacade.getArmEngagement(userId, sessionId, hoursBack));
    }

    @PostMapping("/identities/merge")
    public ResponseEntity<IdentityMergeResult> mergeIdentities(@RequestBody IdentityMergeRequest request) {
        if (request == null) {
            throw new RecommendationValidationException("body", "request body is required");
        }
        return ResponseEntity.ok(recommendationFacade.mergeIdentities(request.sessionId(), request.userId()));
    }
}
