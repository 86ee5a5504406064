package net.chapterone.boot.scheduler;

import net.chapterone.config.SimilarityProperties;
import net.chapterone.service.similarity.SimilarityIndexService;
import net.chapterone.service.similarity.SimilarityIndexService.IndexRefreshSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically pulls catalog changes and rebuilds the similarity index when books changed.
 */
@Component
public class SimilarityIndexRefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(SimilarityIndexRefreshScheduler.class);

    private final SimilarityIndexService similarityIndexService;
    private final SimilarityProperties properties;

    public SimilarityIndexRefreshScheduler(SimilarityIndexService similarityIndexService,
                                           SimilarityProperties properties) {
        this.similarityIndexService = similarityIndexService;
        this.properties = properties;
    }

    /**
     * Failures are logged at {@code ERROR} and rethrown; the previous index keeps serving.
     */
    @Scheduled(cron = "${app.similarity.refresh-cron:0 0 */6 * * *}")
    public void refreshSimilarityIndex() {
        if (!properties.isRefreshEnabled()) {
            log.debug("Similarity index refresh skipped because it is disabled via configuration.");
            return;
        }
        try {
            IndexRefreshSummary summary = similarityIndexService.refreshChanged();
            if (summary.rebuilt()) {
                log.info("Similarity index refreshed (booksPulled={}, booksIndexed={}, vocabulary={}).",
                    summary.booksPulled(), summary.booksIndexed(), summary.vocabularySize());
            }
        } catch (RuntimeException exception) {
            log.error("Similarity index refresh failed; previous index keeps serving.", exception);
            throw exception;
        }
    }
}
