/**
 * REST controller serving contextual recommendations.
 *
 * Features:
 * - Ranks caller-supplied candidate books for a reading context
 * - Returns the arm used and its UCB diagnostics
 * - Serves the popularity ranking when the bandit feature flag is off
 * - Exposes text-similarity neighbours of an indexed book
 */
package net.chapterone.controller;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.chapterone.application.RecommendationFacade;
import net.chapterone.application.recommendation.SelectRecommendationUseCase.RecommendationResult;
import net.chapterone.config.FeatureFlagConfig;
import net.chapterone.controller.dto.RecommendationRequest;
import net.chapterone.exception.RecommendationValidationException;
import net.chapterone.service.similarity.SimilarityMatch;
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
@Slf4j
public class RecommendationController {

    private static final int MAX_SIMILAR_LIMIT = 50;

    private final RecommendationFacade recommendationFacade;
    private final FeatureFlagConfig featureFlagConfig;

    public RecommendationController(RecommendationFacade recommendationFacade, FeatureFlagConfig featureFlagConfig) {
        this.recommendationFacade = recommendationFacade;
        this.featureFlagConfig = featureFlagConfig;
    }

    /**
     * Selects and ranks recommendations for the request's reading context.
     *
     * @param request context, candidates and optional identity
     * @return ranked books with the arm used and selection diagnostics
     */
    @PostMapping("/recommendations")
    public ResponseEntity<RecommendationResult> recommend(@RequestBody RecommendationRequest request) {
        if (request == null) {
            throw new RecommendationValidationException("body", "request body is required");
        }
        boolean personalized = featureFlagConfig.isBanditEnabled();
        RecommendationResult result = recommendationFacade.selectRecommendation(
            request.readingContext(),
            request.candidates(),
            request.userId(),
            request.sessionId(),
            request.limit(),
            personalized
        );
        log.debug("Served {} books via {}", result.bookList().size(), result.armUsed());
        return ResponseEntity.ok(result);
    }

    /**
     * Books whose text is closest to the given book.
     */
    @GetMapping("/books/{bookId}/similar")
    public ResponseEntity<List<SimilarityMatch>> similarBooks(
            @PathVariable("bookId") String bookId,
            @RequestParam(name = "limit", defaultValue = "10") int limit,
            @RequestParam(name = "threshold", required = false) Double threshold) {
        if (limit < 1) {
            throw new RecommendationValidationException("limit", "limit must be 1 or greater");
        }
        return ResponseEntity.ok(
            recommendationFacade.findSimilarBooks(bookId, Math.min(limit, MAX_SIMILAR_LIMIT), threshold));
    }
}
