package net.chapterone.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for delayed reward attribution.
 */
@Component
@ConfigurationProperties(prefix = "app.attribution")
public class AttributionProperties {

    /**
     * How long after an impression an action may still be credited to it (inclusive).
     */
    private Duration window = Duration.ofDays(7);

    /**
     * Exponential decay rate λ per hour of delay. 1/48 halves a reward after roughly 33 hours.
     */
    private double decayPerHour = 1.0 / 48.0;

    /**
     * Look-back for unattributed actions when a run does not specify one.
     */
    private int defaultWindowHours = 168;

    /**
     * Actions fetched per page of the scan.
     */
    private int pageSize = 200;

    /**
     * Upper bound of actions examined by a single run.
     */
    private int maxActionsPerRun = 10_000;

    /**
     * Cron expression for the scheduled attribution batch.
     */
    private String cron = "0 */15 * * * *";

    /**
     * Whether the scheduled attribution batch runs.
     */
    private boolean schedulerEnabled = true;

    @PostConstruct
    void validate() {
        Assert.isTrue(window != null && !window.isNegative() && !window.isZero(),
            "app.attribution.window must be positive");
        Assert.isTrue(decayPerHour >= 0, "app.attribution.decay-per-hour must be non-negative");
        Assert.isTrue(defaultWindowHours > 0, "app.attribution.default-window-hours must be positive");
        Assert.isTrue(pageSize > 0, "app.attribution.page-size must be positive");
        Assert.isTrue(maxActionsPerRun > 0, "app.attribution.max-actions-per-run must be positive");
    }

    public Duration getWindow() {
        return window;
    }

    public void setWindow(Duration window) {
        this.window = window;
    }

    public double getDecayPerHour() {
        return decayPerHour;
    }

    public void setDecayPerHour(double decayPerHour) {
        this.decayPerHour = decayPerHour;
    }

    public int getDefaultWindowHours() {
        return defaultWindowHours;
    }

    public void setDefaultWindowHours(int defaultWindowHours) {
        this.defaultWindowHours = defaultWindowHours;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public int getMaxActionsPerRun() {
        return maxActionsPerRun;
    }

    public void setMaxActionsPerRun(int maxActionsPerRun) {
        this.maxActionsPerRun = maxActionsPerRun;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public void setSchedulerEnabled(boolean schedulerEnabled) {
        this.schedulerEnabled = schedulerEnabled;
    }
}
