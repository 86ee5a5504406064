package net.chapterone.service.similarity;

/**
 * One query hit: a book and its cosine similarity to the query.
 */
public record SimilarityMatch(String bookId, double similarity) {
}
