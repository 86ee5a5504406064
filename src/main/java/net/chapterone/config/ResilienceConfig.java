/**
 * Resilience policies for calls leaving the process
 * - Retries catalog pulls feeding the similarity index
 * - Keeps the current index when the catalog stays unavailable
 */
package net.chapterone.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.TransientDataAccessException;

@Configuration
public class ResilienceConfig {
    private static final Logger logger = LoggerFactory.getLogger(ResilienceConfig.class);

    /**
     * Retry for book catalog reads
     * - Retries transient data access failures and IllegalStateException raised by the adapters
     * - Fixed wait between attempts from {@code app.similarity.catalog-retry-wait}
     *
     * @return Configured retry instance
     */
    @Bean
    public Retry catalogFetchRetry(SimilarityProperties properties) {
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(Math.max(1, properties.getCatalogMaxAttempts()))
            .waitDuration(properties.getCatalogRetryWait())
            .retryExceptions(TransientDataAccessException.class, IllegalStateException.class)
            .build();

        Retry retry = Retry.of("bookCatalogFetch", config);
        retry.getEventPublisher().onRetry(event ->
            logger.warn("Retrying catalog fetch (attempt {}): {}", event.getNumberOfRetryAttempts(),
                event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage()));
        logger.info("Configured catalog fetch retry: {} attempts, wait {}", config.getMaxAttempts(),
            properties.getCatalogRetryWait());
        return retry;
    }
}
