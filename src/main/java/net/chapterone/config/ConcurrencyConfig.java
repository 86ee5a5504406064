package net.chapterone.config;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Executor used to run personalized selection under a time budget.
 */
@Configuration
public class ConcurrencyConfig {

    private static final String SELECTION_THREAD_PREFIX = "BanditSelect-";
    private static final int SELECTION_QUEUE_PER_THREAD = 16;

    /**
     * Bounded pool; a full queue rejects the task and the caller falls back to the non-personalized ranking.
     */
    @Bean(name = "selectionExecutor", destroyMethod = "shutdownNow")
    public ExecutorService selectionExecutor(RecommendationProperties properties) {
        int threads = properties.getSelectionThreads();
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, SELECTION_THREAD_PREFIX + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(threads * SELECTION_QUEUE_PER_THREAD), threadFactory,
            new ThreadPoolExecutor.AbortPolicy());
    }
}
