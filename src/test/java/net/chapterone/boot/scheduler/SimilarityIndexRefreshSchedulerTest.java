package net.chapterone.boot.scheduler;

import net.chapterone.config.SimilarityProperties;
import net.chapterone.service.similarity.SimilarityIndexService;
import net.chapterone.service.similarity.SimilarityIndexService.IndexRefreshSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SimilarityIndexRefreshSchedulerTest {

    @Mock
    private SimilarityIndexService similarityIndexService;

    @Test
    void should_RefreshChangedBooks_When_Enabled() {
        when(similarityIndexService.refreshChanged()).thenReturn(new IndexRefreshSummary(true, 2, 40, 800));

        new SimilarityIndexRefreshScheduler(similarityIndexService, new SimilarityProperties()).refreshSimilarityIndex();

        verify(similarityIndexService).refreshChanged();
    }

    @Test
    void should_SkipExecution_When_RefreshDisabled() {
        SimilarityProperties properties = new SimilarityProperties();
        properties.setRefreshEnabled(false);

        new SimilarityIndexRefreshScheduler(similarityIndexService, properties).refreshSimilarityIndex();

        verifyNoInteractions(similarityIndexService);
    }

    @Test
    void should_Rethrow_When_CatalogPullFails() {
        when(similarityIndexService.refreshChanged()).thenThrow(new IllegalStateException("catalog down"));
        SimilarityIndexRefreshScheduler scheduler =
            new SimilarityIndexRefreshScheduler(similarityIndexService, new SimilarityProperties());

        assertThatThrownBy(scheduler::refreshSimilarityIndex)
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("catalog down");
    }
}
