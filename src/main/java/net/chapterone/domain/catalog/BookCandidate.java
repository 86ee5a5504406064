package net.chapterone.domain.catalog;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * A book the caller allows the recommender to return.
 *
 * @param bookId catalog identifier
 * @param title display title
 * @param author primary author
 * @param tags mood and genre tags
 * @param popularityScore non-personalized popularity, higher is more popular
 */
public record BookCandidate(
    String bookId,
    @Nullable String title,
    @Nullable String author,
    List<String> tags,
    double popularityScore
) {

    public BookCandidate {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
