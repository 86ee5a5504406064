package net.chapterone.domain.catalog;

/**
 * A book placed in a strategy's ranking.
 *
 * @param bookId catalog identifier
 * @param score strategy-specific relevance, higher first
 * @param reason short label of why the book was ranked
 */
public record RankedBook(String bookId, double score, String reason) {
}
