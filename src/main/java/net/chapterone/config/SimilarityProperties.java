package net.chapterone.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for the TF-IDF index and its catalog refresh.
 */
@Component
@ConfigurationProperties(prefix = "app.similarity")
public class SimilarityProperties {

    /**
     * Minimum cosine similarity returned by the similarity strategy.
     */
    private double defaultThreshold = 0.0;

    /**
     * Cron expression for the incremental catalog pull and index rebuild.
     */
    private String refreshCron = "0 0 */6 * * *";

    private boolean refreshEnabled = true;

    /**
     * Attempts per catalog call before the refresh gives up and keeps the current index.
     */
    private int catalogMaxAttempts = 3;

    private Duration catalogRetryWait = Duration.ofMillis(500);

    public double getDefaultThreshold() {
        return defaultThreshold;
    }

    public void setDefaultThreshold(double defaultThreshold) {
        this.defaultThreshold = defaultThreshold;
    }

    public String getRefreshCron() {
        return refreshCron;
    }

    public void setRefreshCron(String refreshCron) {
        this.refreshCron = refreshCron;
    }

    public boolean isRefreshEnabled() {
        return refreshEnabled;
    }

    public void setRefreshEnabled(boolean refreshEnabled) {
        this.refreshEnabled = refreshEnabled;
    }

    public int getCatalogMaxAttempts() {
        return catalogMaxAttempts;
    }

    public void setCatalogMaxAttempts(int catalogMaxAttempts) {
        this.catalogMaxAttempts = catalogMaxAttempts;
    }

    public Duration getCatalogRetryWait() {
        return catalogRetryWait;
    }

    public void setCatalogRetryWait(Duration catalogRetryWait) {
        this.catalogRetryWait = catalogRetryWait;
    }
}
