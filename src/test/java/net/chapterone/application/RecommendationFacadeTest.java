package net.chapterone.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import net.chapterone.application.identity.IdentityMergeUseCase;
import net.chapterone.application.recommendation.SelectRecommendationUseCase;
import net.chapterone.config.AttributionProperties;
import net.chapterone.config.SimilarityProperties;
import net.chapterone.domain.reward.ActionType;
import net.chapterone.domain.reward.Identity;
import net.chapterone.exception.RecommendationValidationException;
import net.chapterone.exception.ResourceNotFoundException;
import net.chapterone.service.attribution.AttributionEngine;
import net.chapterone.service.bandit.ArmRegistry;
import net.chapterone.service.bandit.BanditStatsAggregator;
import net.chapterone.service.reward.RewardSignalQueryService;
import net.chapterone.service.reward.RewardSignalRecorder;
import net.chapterone.service.similarity.SemanticSimilarityEngine;
import net.chapterone.service.similarity.SimilarityIndexService;
import net.chapterone.service.similarity.SimilarityMatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RecommendationFacadeTest {

    @Mock
    private SelectRecommendationUseCase selectRecommendationUseCase;

    @Mock
    private RewardSignalRecorder rewardSignalRecorder;

    @Mock
    private AttributionEngine attributionEngine;

    @Mock
    private BanditStatsAggregator statsAggregator;

    @Mock
    private IdentityMergeUseCase identityMergeUseCase;

    @Mock
    private SimilarityIndexService similarityIndexService;

    @Mock
    private ArmRegistry armRegistry;

    @Mock
    private RewardSignalQueryService rewardSignalQueryService;

    private SemanticSimilarityEngine similarityEngine;
    private AttributionProperties attributionProperties;
    private RecommendationFacade facade;

    @BeforeEach
    void setUp() {
        similarityEngine = new SemanticSimilarityEngine();
        attributionProperties = new AttributionProperties();
        attributionProperties.setDefaultWindowHours(72);
        SimilarityProperties similarityProperties = new SimilarityProperties();
        similarityProperties.setDefaultThreshold(0.0);
        facade = new RecommendationFacade(selectRecommendationUseCase, rewardSignalRecorder, attributionEngine,
            statsAggregator, identityMergeUseCase, similarityIndexService, similarityEngine, armRegistry,
            rewardSignalQueryService, attributionProperties, similarityProperties);
    }

    @Test
    void should_UseConfiguredWindow_When_BatchWindowOmitted() {
        facade.runAttributionBatch(null);
        facade.runAttributionBatch(12);

        verify(attributionEngine).attributeRewards(72);
        verify(attributionEngine).attributeRewards(12);
    }

    @Test
    void should_ParseActionType_When_InteractionRecorded() {
        facade.recordInteraction("book-1", " SAVE ", null, null, "sess-1");

        verify(rewardSignalRecorder).recordAction(
            eq(Identity.session("sess-1")), eq("book-1"), eq(ActionType.SAVE), isNull(), isNull());
    }

    @Test
    void should_RejectBeforeRecording_When_ActionTypeUnknown() {
        assertThatThrownBy(() -> facade.recordInteraction("book-1", "bookmark", null, "user-1", null))
            .isInstanceOf(RecommendationValidationException.class);

        verifyNoInteractions(rewardSignalRecorder);
    }

    @Test
    void should_ThrowNotFound_When_BookNotIndexed() {
        similarityEngine.buildIndex(Map.of("book-1", "dragons and castles"));

        assertThatThrownBy(() -> facade.findSimilarBooks("book-404", 5, null))
            .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void should_ExcludeQueriedBook_When_SimilarBooksFound() {
        similarityEngine.buildIndex(Map.of(
            "book-1", "dragons and castles",
            "book-2", "dragons over castles at dawn",
            "book-3", "quarterly tax accounting"));

        List<SimilarityMatch> matches = facade.findSimilarBooks(" book-1 ", 5, 0.1);

        assertThat(matches).extracting(SimilarityMatch::bookId).containsExactly("book-2");
    }

    @Test
    void should_ResetSingleScope_When_UserGiven() {
        when(armRegistry.scopeFor("user-1")).thenReturn("user-1");
        when(armRegistry.resetScope("user-1")).thenReturn(5);

        assertThat(facade.resetArms("user-1")).isEqualTo(5);
        verify(armRegistry, never()).resetAll();
    }

    @Test
    void should_ResetEveryScope_When_UserBlank() {
        when(armRegistry.resetAll()).thenReturn(11);

        assertThat(facade.resetArms(" ")).isEqualTo(11);
        verify(armRegistry, never()).resetScope(anyString());
    }

    @Test
    void should_DelegateSelection_When_ShortFormCalled() {
        facade.selectRecommendation(null, List.of(), "user-1");

        verify(selectRecommendationUseCase).select(any());
    }

    @Test
    void should_UseOneWeekForSignalsAndOneDayForEngagement_When_HoursOmitted() {
        facade.getRewardSignals(null, "sess-1", null);
        facade.getArmEngagement("user-1", null, null);
        facade.getRewardSignals("user-1", null, 6);

        verify(rewardSignalQueryService).getRewardSignals(Identity.session("sess-1"), 168);
        verify(rewardSignalQueryService).getArmEngagement(Identity.user("user-1"), 24);
        verify(rewardSignalQueryService).getRewardSignals(Identity.user("user-1"), 6);
    }

    @Test
    void should_ThrowNotFound_When_InteractionUnknown() {
        UUID actionId = UUID.randomUUID();
        when(rewardSignalQueryService.findAction(actionId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> facade.getInteraction(actionId))
            .isInstanceOf(ResourceNotFoundException.class);
    }
}
