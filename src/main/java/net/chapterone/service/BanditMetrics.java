package net.chapterone.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.TimeUnit;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Micrometer meters for selection, recording and attribution.
 */
@Component
public class BanditMetrics {

    private final MeterRegistry meterRegistry;
    private final Timer selectionDuration;
    private final Counter fallbacks;
    private final Counter degradedArms;
    private final Counter actionsRecorded;
    private final Counter impressionsRecorded;
    private final Counter attributionsApplied;
    private final Counter attributionErrors;
    private final Counter attributionConflicts;

    @Autowired
    public BanditMetrics(ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this(meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new));
    }

    public BanditMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.selectionDuration = Timer.builder("bandit.selection.duration")
            .description("Duration of personalized recommendation selection")
            .register(meterRegistry);
        this.fallbacks = Counter.builder("bandit.selection.fallback")
            .description("Selections answered with the non-personalized ranking")
            .register(meterRegistry);
        this.degradedArms = Counter.builder("bandit.arm.degraded")
            .description("Arm updates that fell back to a pseudo-inverse")
            .register(meterRegistry);
        this.actionsRecorded = Counter.builder("bandit.actions.recorded")
            .description("User actions recorded")
            .register(meterRegistry);
        this.impressionsRecorded = Counter.builder("bandit.impressions.recorded")
            .description("Recommendation impressions recorded")
            .register(meterRegistry);
        this.attributionsApplied = Counter.builder("bandit.attribution.applied")
            .description("Actions attributed and applied to an arm")
            .register(meterRegistry);
        this.attributionErrors = Counter.builder("bandit.attribution.errors")
            .description("Malformed or failing records skipped by attribution")
            .register(meterRegistry);
        this.attributionConflicts = Counter.builder("bandit.attribution.conflicts")
            .description("Attribution attempts on actions that were already attributed")
            .register(meterRegistry);
    }

    public BanditMetrics() {
        this(new SimpleMeterRegistry());
    }

    public void recordSelection(long nanos) {
        selectionDuration.record(nanos, TimeUnit.NANOSECONDS);
    }

    public void incrementFallback(String reason) {
        fallbacks.increment();
        meterRegistry.counter("bandit.selection.fallback.reason", "reason", reason).increment();
    }

    public void incrementArmChosen(String armId) {
        meterRegistry.counter("bandit.selection.arm", "arm", armId).increment();
    }

    public void incrementDegraded() {
        degradedArms.increment();
    }

    public void incrementActionsRecorded() {
        actionsRecorded.increment();
    }

    public void incrementImpressionsRecorded(int count) {
        impressionsRecorded.increment(count);
    }

    public void incrementAttributionApplied() {
        attributionsApplied.increment();
    }

    public void incrementAttributionErrors() {
        attributionErrors.increment();
    }

    public void incrementAttributionConflicts() {
        attributionConflicts.increment();
    }

    MeterRegistry registry() {
        return meterRegistry;
    }
}
