package net.chapterone.repository;

import java.time.Instant;
import java.util.List;
import net.chapterone.domain.catalog.CatalogBook;

/**
 * Read access to the book catalog owned by the host product.
 */
public interface BookCatalogGateway {

    List<CatalogBook> fetchAll();

    /** Books created or edited strictly after {@code since}. */
    List<CatalogBook> fetchChangedSince(Instant since);
}
