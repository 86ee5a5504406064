package net.chapterone.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Request-path configuration for {@code selectRecommendation}.
 */
@Component
@ConfigurationProperties(prefix = "app.recommendation")
public class RecommendationProperties {

    private int defaultLimit = 10;

    private int maxLimit = 50;

    /**
     * Budget for personalized selection; past it the non-personalized ranking is returned.
     */
    private Duration selectionTimeout = Duration.ofMillis(750);

    private int selectionThreads = 4;

    /**
     * Entries kept in the encoded-context memo.
     */
    private int contextCacheSize = 2048;

    /**
     * How long the trending and co-occurrence snapshots are reused.
     */
    private Duration popularityCacheTtl = Duration.ofMinutes(5);

    @PostConstruct
    void validate() {
        Assert.isTrue(defaultLimit > 0, "app.recommendation.default-limit must be positive");
        Assert.isTrue(maxLimit >= defaultLimit, "app.recommendation.max-limit must be >= default-limit");
        Assert.isTrue(selectionThreads > 0, "app.recommendation.selection-threads must be positive");
        Assert.isTrue(selectionTimeout != null && !selectionTimeout.isNegative(),
            "app.recommendation.selection-timeout must be non-negative");
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public Duration getSelectionTimeout() {
        return selectionTimeout;
    }

    public void setSelectionTimeout(Duration selectionTimeout) {
        this.selectionTimeout = selectionTimeout;
    }

    public int getSelectionThreads() {
        return selectionThreads;
    }

    public void setSelectionThreads(int selectionThreads) {
        this.selectionThreads = selectionThreads;
    }

    public int getContextCacheSize() {
        return contextCacheSize;
    }

    public void setContextCacheSize(int contextCacheSize) {
        this.contextCacheSize = contextCacheSize;
    }

    public Duration getPopularityCacheTtl() {
        return popularityCacheTtl;
    }

    public void setPopularityCacheTtl(Duration popularityCacheTtl) {
        this.popularityCacheTtl = popularityCacheTtl;
    }
}
