package net.chapterone.application.recommendation;

import jakarta.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import net.chapterone.config.RecommendationProperties;
import net.chapterone.domain.bandit.ArmScore;
import net.chapterone.domain.bandit.ArmSelection;
import net.chapterone.domain.catalog.BookCandidate;
import net.chapterone.domain.catalog.RankedBook;
import net.chapterone.domain.context.ContextVector;
import net.chapterone.domain.context.ReadingContext;
import net.chapterone.domain.reward.Identity;
import net.chapterone.exception.RecommendationValidationException;
import net.chapterone.service.BanditMetrics;
import net.chapterone.service.attribution.AttributionEngine;
import net.chapterone.service.bandit.ArmRegistry;
import net.chapterone.service.bandit.LinUcbSelector;
import net.chapterone.service.context.ContextEncoder;
import net.chapterone.service.reward.RewardSignalRecorder;
import net.chapterone.service.strategy.RankingSupport;
import net.chapterone.service.strategy.RecommendationStrategy;
import net.chapterone.service.strategy.StrategyCatalog;
import net.chapterone.service.strategy.StrategyRequest;
import net.chapterone.util.LoggingUtils;
import net.chapterone.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Application use case that picks an arm for the reader's context, ranks the candidates with it and
 * records one impression per returned book.
 *
 * <p>Personalized selection runs on the selection executor under a time budget. A timeout,
 * interruption, rejection or failure returns the non-personalized popularity ranking instead;
 * fallback rankings are not recorded as impressions because no arm produced them.</p>
 */
@Service
public class SelectRecommendationUseCase {

    private static final Logger log = LoggerFactory.getLogger(SelectRecommendationUseCase.class);

    public static final String FALLBACK_ARM = "fallback_popular";

    private final ContextEncoder contextEncoder;
    private final LinUcbSelector selector;
    private final ArmRegistry armRegistry;
    private final StrategyCatalog strategyCatalog;
    private final RewardSignalRecorder recorder;
    private final BanditMetrics metrics;
    private final RecommendationProperties properties;
    private final ExecutorService selectionExecutor;

    public SelectRecommendationUseCase(ContextEncoder contextEncoder,
                                       LinUcbSelector selector,
                                       ArmRegistry armRegistry,
                                       StrategyCatalog strategyCatalog,
                                       RewardSignalRecorder recorder,
                                       BanditMetrics metrics,
                                       RecommendationProperties properties,
                                       @Qualifier("selectionExecutor") ExecutorService selectionExecutor) {
        this.contextEncoder = contextEncoder;
        this.selector = selector;
        this.armRegistry = armRegistry;
        this.strategyCatalog = strategyCatalog;
        this.recorder = recorder;
        this.metrics = metrics;
        this.properties = properties;
        this.selectionExecutor = selectionExecutor;
    }

    /**
     * Selects and ranks recommendations.
     *
     * @throws RecommendationValidationException when candidates are missing or the limit is not positive
     */
    public RecommendationResult select(SelectionCommand command) {
        if (command == null || command.candidates() == null) {
            throw new RecommendationValidationException("candidateBooks", "candidateBooks is required");
        }
        List<BookCandidate> candidates = distinctCandidates(command.candidates());
        int limit = resolveLimit(command.limit());
        ReadingContext context = command.context() == null ? ReadingContext.empty() : command.context();
        Identity identity = identityOf(command.userId(), command.sessionId());
        String scope = armRegistry.scopeFor(command.userId());

        if (candidates.isEmpty()) {
            return new RecommendationResult(List.of(), FALLBACK_ARM, Diagnostics.fallback(scope, "no_candidates", 0L));
        }
        if (!command.personalized()) {
            return fallback(candidates, limit, scope, "disabled", 0L);
        }

        long started = System.nanoTime();
        Future<Selected> future;
        try {
            future = selectionExecutor.submit(
                () -> runSelection(context, candidates, identity, limit, command.userId()));
        } catch (RejectedExecutionException ex) {
            log.warn("Selection executor saturated; serving popularity ranking");
            return fallback(candidates, limit, scope, "overloaded", elapsedMillis(started));
        }

        Selected selected;
        Duration timeout = properties.getSelectionTimeout();
        try {
            selected = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Selection exceeded {} ms; serving popularity ranking", timeout.toMillis());
            return fallback(candidates, limit, scope, "timeout", elapsedMillis(started));
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return fallback(candidates, limit, scope, "interrupted", elapsedMillis(started));
        } catch (ExecutionException ex) {
            LoggingUtils.error(log, ex.getCause(), "Personalized selection failed; serving popularity ranking");
            return fallback(candidates, limit, scope, "error", elapsedMillis(started));
        }
        if (selected == null) {
            return fallback(candidates, limit, scope, "no_eligible_arm", elapsedMillis(started));
        }

        long nanos = System.nanoTime() - started;
        metrics.recordSelection(nanos);
        metrics.incrementArmChosen(selected.selection().armId());
        List<RecommendedBook> books = recordImpressions(identity, scope, selected);
        return new RecommendationResult(books, selected.selection().armId(),
            Diagnostics.personalized(scope, selected.selection(), nanos / 1_000_000));
    }

    private Selected runSelection(ReadingContext context, List<BookCandidate> candidates,
                                  @Nullable Identity identity, int limit, @Nullable String userId) {
        ContextVector vector = contextEncoder.encode(context);
        StrategyRequest request = new StrategyRequest(context, vector, candidates, identity, limit);
        ArmSelection selection = selector.selectArm(vector, strategyCatalog.armIds(), userId).orElse(null);
        if (selection == null) {
            return null;
        }
        RecommendationStrategy strategy = strategyCatalog.find(selection.armId())
            .orElseThrow(() -> new IllegalStateException("No strategy registered for arm " + selection.armId()));
        return new Selected(selection, strategy.rank(request), vector);
    }

    private List<RecommendedBook> recordImpressions(@Nullable Identity identity, String scope, Selected selected) {
        ContextVector vector = selected.contextVector();
        List<RecommendedBook> books = new ArrayList<>(selected.ranked().size());
        int recorded = 0;
        for (int i = 0; i < selected.ranked().size(); i++) {
            RankedBook ranked = selected.ranked().get(i);
            int rank = i + 1;
            UUID impressionId = null;
            if (identity != null) {
                try {
                    impressionId = recorder.recordImpression(identity, ranked.bookId(), vector,
                        selected.selection().armId(), rank, ranked.score(),
                        Map.of(AttributionEngine.SCOPE_METADATA_KEY, scope, "reason", ranked.reason()));
                    recorded++;
                } catch (RuntimeException ex) {
                    LoggingUtils.warn(log, ex, "Failed to record impression for book {}", ranked.bookId());
                }
            }
            books.add(new RecommendedBook(ranked.bookId(), rank, ranked.score(), ranked.reason(), impressionId));
        }
        if (identity == null) {
            log.debug("No identity on request; {} books returned without impressions", books.size());
        } else {
            log.debug("Recorded {} impressions for arm {}", recorded, selected.selection().armId());
        }
        return books;
    }

    private RecommendationResult fallback(List<BookCandidate> candidates, int limit, String scope, String reason,
                                          long elapsedMillis) {
        metrics.incrementFallback(reason);
        List<RecommendedBook> books = new ArrayList<>();
        List<RankedBook> ranked = RankingSupport.fallback(candidates, limit);
        for (int i = 0; i < ranked.size(); i++) {
            RankedBook book = ranked.get(i);
            books.add(new RecommendedBook(book.bookId(), i + 1, book.score(), book.reason(), null));
        }
        return new RecommendationResult(books, FALLBACK_ARM, Diagnostics.fallback(scope, reason, elapsedMillis));
    }

    private int resolveLimit(@Nullable Integer requested) {
        if (requested == null) {
            return properties.getDefaultLimit();
        }
        if (requested < 1) {
            throw new RecommendationValidationException("limit", "limit must be 1 or greater");
        }
        return Math.min(requested, properties.getMaxLimit());
    }

    private static List<BookCandidate> distinctCandidates(List<BookCandidate> candidates) {
        Map<String, BookCandidate> byId = new LinkedHashMap<>();
        for (BookCandidate candidate : candidates) {
            if (candidate == null || !ValidationUtils.hasText(candidate.bookId())) {
                throw new RecommendationValidationException("candidateBooks", "every candidate needs a bookId");
            }
            byId.putIfAbsent(candidate.bookId(), candidate);
        }
        return List.copyOf(byId.values());
    }

    @Nullable
    private static Identity identityOf(@Nullable String userId, @Nullable String sessionId) {
        if (!ValidationUtils.hasText(userId) && !ValidationUtils.hasText(sessionId)) {
            return null;
        }
        return new Identity(userId, sessionId);
    }

    private static long elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }

    private record Selected(ArmSelection selection, List<RankedBook> ranked, ContextVector contextVector) {
    }

    /**
     * Input of one selection.
     *
     * @param personalized false skips the bandit and returns the popularity ranking
     */
    public record SelectionCommand(
        @Nullable ReadingContext context,
        List<BookCandidate> candidates,
        @Nullable String userId,
        @Nullable String sessionId,
        @Nullable Integer limit,
        boolean personalized
    ) {
    }

    /**
     * A returned book.
     *
     * @param impressionId recorded impression, null when no identity was given or the book came from the fallback
     */
    public record RecommendedBook(String bookId, int rank, double score, String reason, @Nullable UUID impressionId) {
    }

    public record RecommendationResult(List<RecommendedBook> bookList, String armUsed, Diagnostics diagnostics) {

        public RecommendationResult {
            bookList = List.copyOf(bookList);
        }
    }

    /**
     * How the result was produced.
     *
     * @param fallbackReason why the popularity ranking was used, null for personalized results
     * @param armScores UCB breakdown of every considered arm
     * @param excludedArms degraded arms skipped by the selector
     */
    public record Diagnostics(
        String scope,
        boolean fallback,
        @Nullable String fallbackReason,
        double predictedReward,
        double confidenceBonus,
        double ucbScore,
        double explorationLevel,
        List<ArmScore> armScores,
        List<String> excludedArms,
        long selectionMillis
    ) {

        static Diagnostics personalized(String scope, ArmSelection selection, long millis) {
            return new Diagnostics(scope, false, null, selection.predictedReward(), selection.confidenceBonus(),
                selection.ucbScore(), selection.explorationLevel(), selection.considered(), selection.excluded(),
                millis);
        }

        static Diagnostics fallback(String scope, String reason, long millis) {
            return new Diagnostics(scope, true, reason, 0.0, 0.0, 0.0, 0.0, List.of(), List.of(), millis);
        }
    }
}
