package com.paxkun.magpie.service.acquisition;

import com.paxkun.magpie.service.LoggerService;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Wraps an {@link ExecutorService} so a worker pool can be scoped with try-with-resources.
 *
 * <pre>
 * try (AutoCloseableExecutor workers = new AutoCloseableExecutor(Executors.newFixedThreadPool(4), logger, Duration.ofMinutes(1))) {
 *     workers.executor().submit(() -> { ... });
 * }
 * </pre>
 *
 * Author: Pax
 */
public record AutoCloseableExecutor(ExecutorService executor, LoggerService logger, Duration shutdownTimeout)
        implements AutoCloseable {

    /**
     * Stops accepting work and waits for running tasks; forces shutdown after the timeout.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
                logger.warn("EXECUTOR", "Worker pool did not terminate within " + shutdownTimeout + ", forced shutdown.");
            } else {
                logger.debug("EXECUTOR", "Worker pool shut down cleanly.");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            logger.error("EXECUTOR", "Worker pool shutdown interrupted", e);
        }
    }
}
