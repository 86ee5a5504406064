package net.chapterone.domain.catalog;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.StringJoiner;

/**
 * Book text pulled from the catalog for the similarity index.
 */
public record CatalogBook(
    String bookId,
    String title,
    @Nullable String author,
    @Nullable String description,
    @Nullable String categories,
    Instant updatedAt
) {

    /** Title, author, categories and description joined into one indexable document. */
    public String indexableText() {
        StringJoiner joiner = new StringJoiner(" ");
        joiner.add(title == null ? "" : title);
        if (author != null) {
            joiner.add(author);
        }
        if (categories != null) {
            joiner.add(categories);
        }
        if (description != null) {
            joiner.add(description);
        }
        return joiner.toString();
    }
}
