/**
 * Main application class for the ChapterOne recommendation core
 *
 * Features:
 * - Hosts the contextual bandit that chooses a recommendation strategy per reading context
 * - Enables scheduling for reward attribution and similarity index refresh
 * - Entry point for Spring Boot application
 */

package net.chapterone;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@SpringBootApplication(exclude = {
    // Schema is applied out of band; never run schema.sql on startup
    org.springframework.boot.jdbc.autoconfigure.DataSourceInitializationAutoConfiguration.class
})
@EnableScheduling
public class ChapterOneRecommendationApplication {

    private static final Logger log = LoggerFactory.getLogger(ChapterOneRecommendationApplication.class);
    private static final int APPLICATION_SCHEDULER_POOL_SIZE = 2;
    private static final int APPLICATION_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS = 30;
    private static final String APPLICATION_SCHEDULER_THREAD_PREFIX = "AppScheduler-";

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile();
        SpringApplication.run(ChapterOneRecommendationApplication.class, args);
    }

    /**
     * Scheduler for the attribution batch and similarity refresh jobs. Two threads keep a long
     * attribution run from delaying an index refresh.
     *
     * @return application task scheduler used by Spring scheduling infrastructure
     */
    @Bean(name = "taskScheduler")
    public TaskScheduler applicationTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setThreadNamePrefix(APPLICATION_SCHEDULER_THREAD_PREFIX);
        scheduler.setPoolSize(APPLICATION_SCHEDULER_POOL_SIZE);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(APPLICATION_SCHEDULER_SHUTDOWN_TIMEOUT_SECONDS);
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static void loadDotEnvFile() {
        try {
            Path envFile = Paths.get(".env");
            if (Files.exists(envFile)) {
                Properties props = new Properties();
                try (InputStream is = Files.newInputStream(envFile)) {
                    props.load(is);
                }
                // Real environment variables win over .env entries
                for (String key : props.stringPropertyNames()) {
                    if (System.getenv(key) == null) {
                        System.setProperty(key, props.getProperty(key));
                    }
                }
            }
        } catch (IOException | SecurityException e) {
            log.warn("Failed to load .env file; aborting startup", e);
            throw new IllegalStateException("Failed to load .env file", e);
        }
    }
}
