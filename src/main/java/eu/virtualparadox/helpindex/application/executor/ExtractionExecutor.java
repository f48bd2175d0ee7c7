package eu.virtualparadox.helpindex.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Fixed-width pool running HTML text extraction during an index rebuild.
 */
public class ExtractionExecutor extends ThreadPoolTaskExecutor {

    /**
     * Creates and initializes a pool with exactly {@code workers} threads.
     *
     * @param workers pool width, at least 1
     * @return initialized executor
     */
    public static ExtractionExecutor create(final int workers) {
        final int width = Math.max(1, workers);
        final ExtractionExecutor executor = new ExtractionExecutor();
        executor.setCorePoolSize(width);
        executor.setMaxPoolSize(width);             // fixed width, never scales up
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("extract-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
