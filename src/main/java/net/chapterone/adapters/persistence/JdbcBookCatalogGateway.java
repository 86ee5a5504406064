package net.chapterone.adapters.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import net.chapterone.domain.catalog.CatalogBook;
import net.chapterone.repository.BookCatalogGateway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Reads indexable book text from the host product's {@code books} table.
 */
@Repository
@ConditionalOnProperty(name = "app.persistence.mode", havingValue = "jdbc")
public class JdbcBookCatalogGateway implements BookCatalogGateway {

    private static final String SELECT_COLUMNS = """
        SELECT id, title, author, description, categories, updated_at
        FROM books
        """;

    private final JdbcTemplate jdbcTemplate;

    public JdbcBookCatalogGateway(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<CatalogBook> fetchAll() {
        try {
            return jdbcTemplate.query(SELECT_COLUMNS + "ORDER BY id", JdbcBookCatalogGateway::mapBook);
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to load book catalog", ex);
        }
    }

    @Override
    public List<CatalogBook> fetchChangedSince(Instant since) {
        try {
            return jdbcTemplate.query(SELECT_COLUMNS + "WHERE updated_at > ? ORDER BY id",
                JdbcBookCatalogGateway::mapBook, Timestamp.from(since));
        } catch (DataAccessException ex) {
            throw new IllegalStateException("Failed to load catalog changes since " + since, ex);
        }
    }

    private static CatalogBook mapBook(ResultSet rs, int rowNum) throws SQLException {
        return new CatalogBook(
            rs.getString("id"),
            rs.getString("title"),
            rs.getString("author"),
            rs.getString("description"),
            rs.getString("categories"),
            rs.getTimestamp("updated_at").toInstant());
    }
}
