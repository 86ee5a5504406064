package net.chapterone.application.identity;

import net.chapterone.domain.reward.IdentityMergeResult;
import net.chapterone.exception.RecommendationValidationException;
import net.chapterone.repository.ActionRepository;
import net.chapterone.repository.ImpressionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdentityMergeUseCaseTest {

    @Mock
    private ImpressionRepository impressionRepository;

    @Mock
    private ActionRepository actionRepository;

    private IdentityMergeUseCase useCase;

    @BeforeEach
    void setUp() {
        useCase = new IdentityMergeUseCase(impressionRepository, actionRepository);
    }

    @Test
    void should_ReassignImpressionsAndActions_When_IdsValid() {
        when(impressionRepository.reassignImpressions("s-1", "reader-1")).thenReturn(6);
        when(actionRepository.reassignActions("s-1", "reader-1")).thenReturn(2);

        IdentityMergeResult result = useCase.merge(" s-1 ", "reader-1 ");

        assertThat(result).isEqualTo(new IdentityMergeResult("s-1", "reader-1", 6, 2));
        verify(impressionRepository).reassignImpressions("s-1", "reader-1");
        verify(actionRepository).reassignActions("s-1", "reader-1");
    }

    @Test
    void should_RejectMerge_When_SessionBlank() {
        assertThatThrownBy(() -> useCase.merge("  ", "reader-1"))
            .isInstanceOf(RecommendationValidationException.class)
            .hasMessageContaining("sessionId");
        verifyNoInteractions(impressionRepository, actionRepository);
    }

    @Test
    void should_RejectMerge_When_UserMissing() {
        assertThatThrownBy(() -> useCase.merge("s-1", null))
            .isInstanceOf(RecommendationValidationException.class)
            .hasMessageContaining("userId");
        verifyNoInteractions(impressionRepository, actionRepository);
    }
}
