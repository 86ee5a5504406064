package net.chapterone.service.similarity;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import net.chapterone.adapters.memory.InMemoryBookCatalogGateway;
import net.chapterone.domain.catalog.CatalogBook;
import net.chapterone.repository.BookCatalogGateway;
import net.chapterone.service.similarity.SimilarityIndexService.IndexRefreshSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SimilarityIndexServiceTest {

    private static final Instant PULLED_AT = Instant.parse("2026-08-01T06:00:00Z");

    private InMemoryBookCatalogGateway catalog;
    private SemanticSimilarityEngine engine;
    private Retry retry;
    private SimilarityIndexService service;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryBookCatalogGateway();
        catalog.upsertAll(List.of(
            book("walden", "Walden", "life in the woods simple living nature solitude", PULLED_AT.minusSeconds(600)),
            book("silent-spring", "Silent Spring", "pesticides nature ecology birds", PULLED_AT.minusSeconds(600))
        ));
        engine = new SemanticSimilarityEngine();
        retry = Retry.of("test", RetryConfig.custom()
            .maxAttempts(2)
            .waitDuration(Duration.ofMillis(1))
            .retryExceptions(IllegalStateException.class)
            .build());
        service = new SimilarityIndexService(catalog, engine, retry, Clock.fixed(PULLED_AT, ZoneOffset.UTC));
    }

    @Test
    void should_IndexWholeCatalog_When_Rebuilding() {
        IndexRefreshSummary summary = service.rebuildFromCatalog();

        assertThat(summary.rebuilt()).isTrue();
        assertThat(summary.booksPulled()).isEqualTo(2);
        assertThat(summary.booksIndexed()).isEqualTo(2);
        assertThat(engine.similarTo("walden", 5, 0.0)).extracting(SimilarityMatch::bookId)
            .containsExactly("silent-spring");
    }

    @Test
    void should_DoFullPull_When_RefreshingBeforeAnyPull() {
        IndexRefreshSummary summary = service.refreshChanged();

        assertThat(summary.rebuilt()).isTrue();
        assertThat(engine.currentIndex().indexedBookCount()).isEqualTo(2);
    }

    @Test
    void should_KeepCurrentIndex_When_NothingChanged() {
        service.rebuildFromCatalog();
        SimilarityIndex served = engine.currentIndex();

        IndexRefreshSummary summary = service.refreshChanged();

        assertThat(summary.rebuilt()).isFalse();
        assertThat(summary.booksPulled()).isZero();
        assertThat(engine.currentIndex()).isSameAs(served);
    }

    @Test
    void should_MergeChangedBooks_When_CatalogUpdated() {
        service.rebuildFromCatalog();
        catalog.upsert(book("thoreau-essays", "Civil Disobedience", "essays nature conscience government",
            PULLED_AT.plusSeconds(60)));

        IndexRefreshSummary summary = service.refreshChanged();

        assertThat(summary.rebuilt()).isTrue();
        assertThat(summary.booksPulled()).isEqualTo(1);
        assertThat(summary.booksIndexed()).isEqualTo(3);
        assertThat(engine.currentIndex().vectorOf("walden")).isPresent();
    }

    @Test
    void should_RetryAndKeepServedIndex_When_CatalogUnavailable() {
        BookCatalogGateway failing = mock(BookCatalogGateway.class);
        when(failing.fetchAll()).thenThrow(new IllegalStateException("catalog unavailable"));
        SimilarityIndexService failingService = new SimilarityIndexService(failing, engine, retry,
            Clock.fixed(PULLED_AT, ZoneOffset.UTC));
        SimilarityIndex served = engine.currentIndex();

        assertThatThrownBy(failingService::rebuildFromCatalog).isInstanceOf(IllegalStateException.class);
        failingService.initializeIndex();

        verify(failing, times(4)).fetchAll();
        assertThat(engine.currentIndex()).isSameAs(served);
    }

    private static CatalogBook book(String id, String title, String description, Instant updatedAt) {
        return new CatalogBook(id, title, null, description, null, updatedAt);
    }
}
