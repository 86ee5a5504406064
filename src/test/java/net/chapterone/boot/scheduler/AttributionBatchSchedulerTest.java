package net.chapterone.boot.scheduler;

import net.chapterone.config.AttributionProperties;
import net.chapterone.domain.reward.AttributionResult;
import net.chapterone.service.attribution.AttributionEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AttributionBatchSchedulerTest {

    @Mock
    private AttributionEngine attributionEngine;

    @Test
    void should_RunBatchOverDefaultWindow_When_SchedulerEnabled() {
        AttributionProperties properties = new AttributionProperties();
        properties.setDefaultWindowHours(72);
        when(attributionEngine.attributeRewards(72)).thenReturn(new AttributionResult(3, 2, 1, 0, 0, false));

        new AttributionBatchScheduler(attributionEngine, properties).runScheduledAttribution();

        verify(attributionEngine).attributeRewards(72);
    }

    @Test
    void should_SkipExecution_When_SchedulerDisabled() {
        AttributionProperties properties = new AttributionProperties();
        properties.setSchedulerEnabled(false);

        new AttributionBatchScheduler(attributionEngine, properties).runScheduledAttribution();

        verifyNoInteractions(attributionEngine);
    }

    @Test
    void should_Propagate_When_BatchFailsAsAWhole() {
        AttributionProperties properties = new AttributionProperties();
        when(attributionEngine.attributeRewards(168)).thenThrow(new IllegalStateException("store unavailable"));

        assertThatThrownBy(() -> new AttributionBatchScheduler(attributionEngine, properties).runScheduledAttribution())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("store unavailable");
    }
}
