package net.chapterone.service.similarity;

import io.github.resilience4j.retry.Retry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import net.chapterone.domain.catalog.CatalogBook;
import net.chapterone.repository.BookCatalogGateway;
import net.chapterone.util.LoggingUtils;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Keeps the similarity index in step with the book catalog.
 *
 * <p>A full pull seeds the corpus at startup; refreshes pull only books changed since the previous
 * pull, merge them into the corpus and rebuild the whole index. A failed pull keeps the index that is
 * already being served.</p>
 */
@Slf4j
@Service
public class SimilarityIndexService {

    private final BookCatalogGateway catalogGateway;
    private final SemanticSimilarityEngine engine;
    private final Retry catalogFetchRetry;
    private final Clock clock;

    private final ReentrantLock refreshLock = new ReentrantLock();
    private final Map<String, String> corpus = new TreeMap<>();
    private Instant lastPulledAt;

    public SimilarityIndexService(BookCatalogGateway catalogGateway,
                                  SemanticSimilarityEngine engine,
                                  Retry catalogFetchRetry,
                                  Clock clock) {
        this.catalogGateway = catalogGateway;
        this.engine = engine;
        this.catalogFetchRetry = catalogFetchRetry;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initializeIndex() {
        try {
            rebuildFromCatalog();
        } catch (RuntimeException ex) {
            LoggingUtils.error(log, ex, "Initial similarity index build failed; serving an empty index");
        }
    }

    /**
     * Pulls the whole catalog and rebuilds the index from it.
     */
    public IndexRefreshSummary rebuildFromCatalog() {
        refreshLock.lock();
        try {
            Instant pulledAt = clock.instant();
            List<CatalogBook> books = Retry.decorateSupplier(catalogFetchRetry, catalogGateway::fetchAll).get();
            corpus.clear();
            books.forEach(book -> corpus.put(book.bookId(), book.indexableText()));
            lastPulledAt = pulledAt;
            SimilarityIndex index = engine.buildIndex(Map.copyOf(corpus));
            return new IndexRefreshSummary(true, books.size(), index.indexedBookCount(), index.vocabularySize());
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Pulls books changed since the last pull and rebuilds. Falls back to a full pull when nothing
     * has been pulled yet.
     */
    public IndexRefreshSummary refreshChanged() {
        refreshLock.lock();
        try {
            if (lastPulledAt == null) {
                return rebuildFromCatalog();
            }
            Instant pulledAt = clock.instant();
            Instant since = lastPulledAt;
            List<CatalogBook> changed = Retry.decorateSupplier(catalogFetchRetry,
                () -> catalogGateway.fetchChangedSince(since)).get();
            lastPulledAt = pulledAt;
            if (changed.isEmpty()) {
                SimilarityIndex index = engine.currentIndex();
                log.debug("No catalog changes since {}; keeping current index", since);
                return new IndexRefreshSummary(false, 0, index.indexedBookCount(), index.vocabularySize());
            }
            changed.forEach(book -> corpus.put(book.bookId(), book.indexableText()));
            SimilarityIndex index = engine.buildIndex(Map.copyOf(corpus));
            return new IndexRefreshSummary(true, changed.size(), index.indexedBookCount(), index.vocabularySize());
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Outcome of one catalog pull.
     *
     * @param rebuilt whether a new index was swapped in
     * @param booksPulled books returned by the catalog
     * @param booksIndexed books with a non-zero vector in the served index
     * @param vocabularySize distinct terms in the served index
     */
    public record IndexRefreshSummary(boolean rebuilt, int booksPulled, int booksIndexed, int vocabularySize) {
    }
}
