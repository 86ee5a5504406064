package net.chapterone.boot.scheduler;

import net.chapterone.config.AttributionProperties;
import net.chapterone.domain.reward.AttributionResult;
import net.chapterone.service.attribution.AttributionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic attribution batch that turns recorded actions into arm rewards.
 *
 * <p>Runs on the application task scheduler, so it never overlaps with itself. Per-record failures
 * are counted in the batch result; only a failure of the whole batch surfaces as an exception so
 * scheduler telemetry marks the run as failed.</p>
 */
@Component
public class AttributionBatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(AttributionBatchScheduler.class);

    private final AttributionEngine attributionEngine;
    private final AttributionProperties properties;

    public AttributionBatchScheduler(AttributionEngine attributionEngine, AttributionProperties properties) {
        this.attributionEngine = attributionEngine;
        this.properties = properties;
    }

    @Scheduled(cron = "${app.attribution.cron:0 */15 * * * *}")
    public void runScheduledAttribution() {
        if (!properties.isSchedulerEnabled()) {
            log.debug("Attribution scheduler skipped because it is disabled via configuration.");
            return;
        }
        AttributionResult result = attributionEngine.attributeRewards(properties.getDefaultWindowHours());
        if (result.errors() > 0) {
            log.warn("Scheduled attribution finished with {} errors out of {} processed actions.",
                result.errors(), result.processed());
        }
    }
}
