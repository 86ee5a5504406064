package net.chapterone.controller;

import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import net.chapterone.application.RecommendationFacade;
import net.chapterone.domain.bandit.ArmLifecycle;
import net.chapterone.domain.bandit.ArmStatistics;
import net.chapterone.domain.bandit.BanditStatistics;
import net.chapterone.domain.reward.AttributionResult;
import net.chapterone.service.similarity.SimilarityIndexService.IndexRefreshSummary;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.boot.webmvc.test.autoconfigure.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(BanditAdminController.class)
@AutoConfigureMockMvc(addFilters = false)
class BanditAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RecommendationFacade recommendationFacade;

    @Test
    void should_ReturnArmStatistics_When_Requested() throws Exception {
        ArmStatistics trending = new ArmStatistics("trending_popular", "Trending", ArmLifecycle.ACTIVE, 12L, 20L,
            18.0, 1.5, 0.9, 2.1, 0.4, false, null);
        when(recommendationFacade.getArmStatistics("reader-1"))
            .thenReturn(new BanditStatistics("reader-1", List.of(trending), "trending_popular", 12L, 3L, 1.0));

        mockMvc.perform(get("/api/bandit/stats").param("userId", "reader-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.bestPerformingArm").value("trending_popular"))
            .andExpect(jsonPath("$.arms[0].lifecycle").value("ACTIVE"))
            .andExpect(jsonPath("$.arms[0].averageReward").value(1.5));
    }

    @Test
    void should_RunAttributionWithDefaultWindow_When_NoWindowGiven() throws Exception {
        when(recommendationFacade.runAttributionBatch(isNull()))
            .thenReturn(new AttributionResult(10, 7, 1, 2, 0, false));

        mockMvc.perform(post("/admin/bandit/attribution/run"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.processed").value(10))
            .andExpect(jsonPath("$.updated").value(7))
            .andExpect(jsonPath("$.unmatched").value(2));
    }

    @Test
    void should_ReturnIndexSummary_When_RebuildRequested() throws Exception {
        when(recommendationFacade.rebuildSimilarityIndex()).thenReturn(new IndexRefreshSummary(true, 40, 38, 912));

        mockMvc.perform(post("/admin/bandit/similarity/rebuild"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.booksIndexed").value(38))
            .andExpect(jsonPath("$.vocabularySize").value(912));
    }

    @Test
    void should_ReportScopeAndRemovedArms_When_ResettingAll() throws Exception {
        when(recommendationFacade.resetArms(isNull())).thenReturn(5);

        mockMvc.perform(post("/admin/bandit/arms/reset"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.scope").value("all"))
            .andExpect(jsonPath("$.armsRemoved").value(5));
    }
}
