package net.chapterone.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for the LinUCB selector and the arm statistics.
 */
@Component
@ConfigurationProperties(prefix = "app.bandit")
public class BanditProperties {

    /**
     * Exploration coefficient α applied to the confidence bonus. Must be positive.
     */
    private double alpha = 1.0;

    /**
     * Guard added to the exploration-level denominator.
     */
    private double epsilon = 1.0e-9;

    /**
     * Applied rewards an arm needs before it is ACTIVE and eligible as best performing arm.
     */
    private int minSamples = 5;

    /**
     * Keep one set of arm models per signed-in user. Anonymous traffic always uses the global scope.
     */
    private boolean perUserModels = true;

    /**
     * Normal quantile used for the reward confidence interval (1.96 = 95%).
     */
    private double confidenceZ = 1.96;

    /**
     * Reward variance assumed until an arm has two observations.
     */
    private double priorVariance = 1.0;

    /**
     * Arm models kept in memory across all scopes. Least recently used models are dropped and reloaded
     * from the parameter store on their next reference.
     */
    private int modelCacheSize = 10_000;

    @PostConstruct
    void validate() {
        Assert.isTrue(alpha > 0, "app.bandit.alpha must be positive");
        Assert.isTrue(epsilon > 0, "app.bandit.epsilon must be positive");
        Assert.isTrue(minSamples >= 1, "app.bandit.min-samples must be at least 1");
        Assert.isTrue(confidenceZ > 0, "app.bandit.confidence-z must be positive");
        Assert.isTrue(priorVariance >= 0, "app.bandit.prior-variance must be non-negative");
        Assert.isTrue(modelCacheSize >= 1, "app.bandit.model-cache-size must be at least 1");
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        this.alpha = alpha;
    }

    public double getEpsilon() {
        return epsilon;
    }

    public void setEpsilon(double epsilon) {
        this.epsilon = epsilon;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public boolean isPerUserModels() {
        return perUserModels;
    }

    public void setPerUserModels(boolean perUserModels) {
        this.perUserModels = perUserModels;
    }

    public double getConfidenceZ() {
        return confidenceZ;
    }

    public void setConfidenceZ(double confidenceZ) {
        this.confidenceZ = confidenceZ;
    }

    public double getPriorVariance() {
        return priorVariance;
    }

    public void setPriorVariance(double priorVariance) {
        this.priorVariance = priorVariance;
    }

    public int getModelCacheSize() {
        return modelCacheSize;
    }

    public void setModelCacheSize(int modelCacheSize) {
        this.modelCacheSize = modelCacheSize;
    }
}
