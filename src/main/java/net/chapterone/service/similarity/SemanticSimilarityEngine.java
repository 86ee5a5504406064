package net.chapterone.service.similarity;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Holds the live {@link SimilarityIndex} and answers nearest-neighbour queries against it.
 *
 * <p>Thread-safety: rebuilds construct a new index off to the side and publish it with a single
 * reference swap. A query reads the reference once, so it sees either the previous or the new index
 * in full, never a mix.</p>
 */
@Component
public class SemanticSimilarityEngine {

    private static final Logger logger = LoggerFactory.getLogger(SemanticSimilarityEngine.class);

    static final Comparator<SimilarityMatch> RANKING = Comparator
        .comparingDouble(SimilarityMatch::similarity).reversed()
        .thenComparing(SimilarityMatch::bookId);

    private final AtomicReference<SimilarityIndex> current = new AtomicReference<>(SimilarityIndex.empty());
    private final Clock clock;

    @Autowired
    public SemanticSimilarityEngine(Clock clock) {
        this.clock = clock;
    }

    public SemanticSimilarityEngine() {
        this(Clock.systemUTC());
    }

    /**
     * Builds a new index from the corpus and swaps it in.
     *
     * @param corpus book id to indexable text
     * @return the index now being served
     */
    public SimilarityIndex buildIndex(Map<String, String> corpus) {
        long started = System.nanoTime();
        SimilarityIndex rebuilt = SimilarityIndex.build(corpus, clock.instant());
        SimilarityIndex previous = current.getAndSet(rebuilt);
        logger.info("Similarity index rebuilt: {} of {} books indexed, {} terms (previous: {} books) in {} ms",
            rebuilt.indexedBookCount(), rebuilt.documentCount(), rebuilt.vocabularySize(),
            previous.indexedBookCount(), (System.nanoTime() - started) / 1_000_000);
        return rebuilt;
    }

    public SimilarityIndex currentIndex() {
        return current.get();
    }

    /**
     * Returns at most {@code k} books whose similarity to {@code vector} is at least
     * {@code thresholdMin}, highest first, ties broken by ascending book id.
     *
     * @param vector query vector in the current index's term space; normalised before use
     */
    public List<SimilarityMatch> query(SparseVector vector, int k, double thresholdMin) {
        return query(current.get(), vector, k, thresholdMin, null);
    }

    /**
     * Vectorizes free text against the current index and queries it.
     */
    public List<SimilarityMatch> queryText(String text, int k, double thresholdMin) {
        SimilarityIndex index = current.get();
        return query(index, index.vectorize(text), k, thresholdMin, null);
    }

    /**
     * Books most similar to an indexed book, excluding the book itself. Empty when the book is not indexed.
     */
    public List<SimilarityMatch> similarTo(String bookId, int k, double thresholdMin) {
        SimilarityIndex index = current.get();
        return index.vectorOf(bookId)
            .map(vector -> query(index, vector, k, thresholdMin, bookId))
            .orElseGet(List::of);
    }

    /**
     * Cosine similarity of two indexed books; 0 when either is not indexed.
     */
    public double similarity(String bookIdA, String bookIdB) {
        SimilarityIndex index = current.get();
        return index.vectorOf(bookIdA)
            .flatMap(a -> index.vectorOf(bookIdB).map(a::dot))
            .orElse(0.0);
    }

    /**
     * Similarity of each listed book to a free-text query; books that are not indexed score 0.
     */
    public Map<String, Double> scoreBooks(String text, Collection<String> bookIds) {
        SimilarityIndex index = current.get();
        SparseVector query = index.vectorize(text);
        Map<String, Double> scores = new HashMap<>();
        for (String bookId : bookIds) {
            double score = query.isZero() ? 0.0 : index.vectorOf(bookId).map(query::dot).orElse(0.0);
            scores.put(bookId, score);
        }
        return scores;
    }

    private static List<SimilarityMatch> query(SimilarityIndex index, SparseVector vector, int k,
                                               double thresholdMin, String excludedBookId) {
        if (k <= 0 || vector == null || vector.isZero()) {
            return List.of();
        }
        SparseVector normalizedQuery = vector.normalized();
        List<SimilarityMatch> matches = new ArrayList<>();
        for (Map.Entry<String, SparseVector> entry : index.bookVectors().entrySet()) {
            if (entry.getKey().equals(excludedBookId)) {
                continue;
            }
            double similarity = normalizedQuery.dot(entry.getValue());
            if (similarity >= thresholdMin) {
                matches.add(new SimilarityMatch(entry.getKey(), similarity));
            }
        }
        matches.sort(RANKING);
        return matches.size() > k ? List.copyOf(matches.subList(0, k)) : List.copyOf(matches);
    }
}
