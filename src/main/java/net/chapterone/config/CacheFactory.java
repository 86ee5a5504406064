package net.chapterone.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import net.chapterone.domain.context.ContextVector;
import net.chapterone.domain.context.ReadingContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Factory for creating Caffeine caches with consistent configuration.
 */
@Configuration
public class CacheFactory {

    /**
     * Create a cache with size limit and time-to-live.
     */
    public <K, V> Cache<K, V> createCache(String name, int maxSize, Duration ttl) {
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(ttl)
            .recordStats()
            .build();
    }

    /**
     * Create a cache with size limit only (no TTL).
     */
    public <K, V> Cache<K, V> createCacheWithSize(String name, int maxSize) {
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .recordStats()
            .build();
    }

    /**
     * Create a cache whose values are held weakly; entries vanish once nothing else references them.
     */
    public <K, V> Cache<K, V> createWeakValueCache(String name) {
        return Caffeine.newBuilder()
            .weakValues()
            .build();
    }

    @Bean
    public Cache<ReadingContext, ContextVector> contextVectorCache(RecommendationProperties properties) {
        return createCacheWithSize("contextVectors", properties.getContextCacheSize());
    }
}
