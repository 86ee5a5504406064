package net.chapterone.adapters.memory;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import net.chapterone.domain.catalog.CatalogBook;
import net.chapterone.repository.BookCatalogGateway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Catalog held in memory; books are registered with {@link #upsert}.
 */
@Component
@ConditionalOnProperty(name = "app.persistence.mode", havingValue = "memory", matchIfMissing = true)
public class InMemoryBookCatalogGateway implements BookCatalogGateway {

    private final Map<String, CatalogBook> books = new ConcurrentHashMap<>();

    public void upsert(CatalogBook book) {
        books.put(book.bookId(), book);
    }

    public void upsertAll(Collection<CatalogBook> catalogBooks) {
        catalogBooks.forEach(this::upsert);
    }

    @Override
    public List<CatalogBook> fetchAll() {
        return books.values().stream()
            .sorted(Comparator.comparing(CatalogBook::bookId))
            .toList();
    }

    @Override
    public List<CatalogBook> fetchChangedSince(Instant since) {
        return books.values().stream()
            .filter(book -> book.updatedAt().isAfter(since))
            .sorted(Comparator.comparing(CatalogBook::bookId))
            .toList();
    }
}
