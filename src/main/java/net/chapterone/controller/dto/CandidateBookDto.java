package net.chapterone.controller.dto;

import java.util.List;
import net.chapterone.domain.catalog.BookCandidate;

/** DTO for a book the client allows in the result. */
public record CandidateBookDto(String bookId, String title, String author, List<String> tags, Double popularityScore) {

    public BookCandidate toDomain() {
        return new BookCandidate(bookId, title, author, tags, popularityScore == null ? 0.0 : popularityScore);
    }
}
