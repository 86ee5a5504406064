/**
 * Configuration for feature flags controlling recommendation behaviour
 *
 * Features:
 * - Centralizes feature toggles read at the HTTP call sites
 * - Default values keep the bandit path on when properties are absent
 */
package net.chapterone.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FeatureFlagConfig {

    private final boolean banditEnabled;

    public FeatureFlagConfig(@Value("${app.feature.bandit.enabled:true}") boolean banditEnabled) {
        this.banditEnabled = banditEnabled;
    }

    /**
     * Provides the contextual bandit feature state
     *
     * @return True if personalized bandit selection is enabled, false otherwise
     *
     * @implNote Defaults to true when property is not specified
     * When false, callers receive the non-personalized popularity ranking
     */
    @Bean
    public boolean isBanditEnabled() {
        return banditEnabled;
    }
}
