/**
 * REST controller for bandit statistics and administrative operations
 *
 * Features:
 * - Reports per-arm reward, confidence interval and exploration state
 * - Triggers an attribution batch on demand
 * - Rebuilds the text similarity index from the catalog
 * - Resets arm models for one user scope or all scopes
 */
package net.chapterone.controller;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.chapterone.application.RecommendationFacade;
import net.chapterone.domain.bandit.BanditStatistics;
import net.chapterone.domain.reward.AttributionResult;
import net.chapterone.service.similarity.SimilarityIndexService.IndexRefreshSummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Slf4j
public class BanditAdminController {

    private final RecommendationFacade recommendationFacade;

    public BanditAdminController(RecommendationFacade recommendationFacade) {
        this.recommendationFacade = recommendationFacade;
    }

    /**
     * Per-arm statistics for a user's scope, or the global scope when no user is given.
     */
    @GetMapping("/api/bandit/stats")
    public ResponseEntity<BanditStatistics> statistics(@RequestParam(name = "userId", required = false) String userId) {
        return ResponseEntity.ok(recommendationFacade.getArmStatistics(userId));
    }

    /**
     * Runs one attribution batch immediately.
     *
     * @param windowHours how far back to scan; the configured default when absent
     */
    @PostMapping("/admin/bandit/attribution/run")
    public ResponseEntity<AttributionResult> runAttribution(
            @RequestParam(name = "windowHours", required = false) Integer windowHours) {
        log.info("Manual attribution run requested (windowHours={})", windowHours);
        return ResponseEntity.ok(recommendationFacade.runAttributionBatch(windowHours));
    }

    @PostMapping("/admin/bandit/similarity/rebuild")
    public ResponseEntity<IndexRefreshSummary> rebuildSimilarityIndex() {
        log.info("Manual similarity index rebuild requested");
        return ResponseEntity.ok(recommendationFacade.rebuildSimilarityIndex());
    }

    /**
     * Resets arm models to the prior.
     *
     * @param userId scope to reset; every scope when absent
     */
    @PostMapping("/admin/bandit/arms/reset")
    public ResponseEntity<Map<String, Object>> resetArms(@RequestParam(name = "userId", required = false) String userId) {
        int removed = recommendationFacade.resetArms(userId);
        log.warn("Bandit arms reset (userId={}, persisted arms removed={})", userId, removed);
        return ResponseEntity.ok(Map.of("scope", userId == null ? "all" : userId, "armsRemoved", removed));
    }
}
