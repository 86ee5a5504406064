package net.chapterone.service.similarity;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable TF-IDF index over a book corpus.
 *
 * <p>TF is the term count divided by document length; IDF is the smoothed
 * {@code ln((1 + N) / (1 + df)) + 1}. Each stored book vector is L2-normalised, so the cosine
 * similarity against a normalised query is a dot product. Books whose text yields no tokens have a
 * zero-norm vector and are left out of the index.</p>
 */
public final class SimilarityIndex {

    private static final SimilarityIndex EMPTY =
        new SimilarityIndex(Map.of(), new double[0], Map.of(), 0, null);

    private final Map<String, Integer> vocabulary;
    private final double[] idf;
    private final Map<String, SparseVector> bookVectors;
    private final int documentCount;
    private final Instant builtAt;

    private SimilarityIndex(Map<String, Integer> vocabulary, double[] idf, Map<String, SparseVector> bookVectors,
                            int documentCount, Instant builtAt) {
        this.vocabulary = vocabulary;
        this.idf = idf;
        this.bookVectors = bookVectors;
        this.documentCount = documentCount;
        this.builtAt = builtAt;
    }

    public static SimilarityIndex empty() {
        return EMPTY;
    }

    /**
     * Builds an index in a single pass over the corpus.
     *
     * @param corpus book id to indexable text
     * @param builtAt timestamp recorded on the index
     */
    public static SimilarityIndex build(Map<String, String> corpus, Instant builtAt) {
        Map<String, List<String>> tokenized = new TreeMap<>();
        Map<String, Integer> documentFrequency = new TreeMap<>();
        for (Map.Entry<String, String> entry : corpus.entrySet()) {
            if (entry.getKey() == null) {
                continue;
            }
            List<String> tokens = TextTokenizer.tokenize(entry.getValue());
            tokenized.put(entry.getKey(), tokens);
            Set<String> unique = new HashSet<>(tokens);
            for (String term : unique) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }

        int n = tokenized.size();
        Map<String, Integer> vocabulary = new HashMap<>();
        double[] idf = new double[documentFrequency.size()];
        int termIndex = 0;
        for (Map.Entry<String, Integer> entry : documentFrequency.entrySet()) {
            vocabulary.put(entry.getKey(), termIndex);
            idf[termIndex] = Math.log((1.0 + n) / (1.0 + entry.getValue())) + 1.0;
            termIndex++;
        }

        Map<String, SparseVector> vectors = new TreeMap<>();
        for (Map.Entry<String, List<String>> entry : tokenized.entrySet()) {
            SparseVector vector = weigh(entry.getValue(), vocabulary, idf).normalized();
            if (!vector.isZero()) {
                vectors.put(entry.getKey(), vector);
            }
        }
        return new SimilarityIndex(Collections.unmodifiableMap(vocabulary), idf,
            Collections.unmodifiableMap(vectors), n, builtAt);
    }

    /**
     * Projects free text into this index's vocabulary. Unknown terms are ignored.
     */
    public SparseVector vectorize(String text) {
        return weigh(TextTokenizer.tokenize(text), vocabulary, idf).normalized();
    }

    public Optional<SparseVector> vectorOf(String bookId) {
        return Optional.ofNullable(bookVectors.get(bookId));
    }

    /** Indexed books in ascending id order. */
    public Map<String, SparseVector> bookVectors() {
        return bookVectors;
    }

    public int vocabularySize() {
        return vocabulary.size();
    }

    /** Books submitted to the build, including the zero-norm ones that were left out. */
    public int documentCount() {
        return documentCount;
    }

    public int indexedBookCount() {
        return bookVectors.size();
    }

    public Instant builtAt() {
        return builtAt;
    }

    private static SparseVector weigh(List<String> tokens, Map<String, Integer> vocabulary, double[] idf) {
        if (tokens.isEmpty()) {
            return SparseVector.empty();
        }
        Map<Integer, Integer> counts = new HashMap<>();
        for (String token : tokens) {
            Integer index = vocabulary.get(token);
            if (index != null) {
                counts.merge(index, 1, Integer::sum);
            }
        }
        Map<Integer, Double> weights = new HashMap<>();
        double length = tokens.size();
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            weights.put(entry.getKey(), (entry.getValue() / length) * idf[entry.getKey()]);
        }
        return SparseVector.of(weights);
    }
}
