package com.paxkun.magpie.config;

import java.time.Duration;

/**
 * Per-URL retry budget and worker cap of the acquisition pool. The transport-level
 * retry of the HTTP client is configured separately in {@link HttpSettings}; the two
 * budgets nest and are tuned independently.
 */
public record AcquisitionSettings(int maxWorkers, int maxAttempts, Duration backoffBase) {

    public static final int WORKER_CAP = 20;

    public AcquisitionSettings {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be positive: " + maxWorkers);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
    }

    /**
     * Worker count actually used: never above {@value #WORKER_CAP} or the processor count.
     */
    public int effectiveWorkers() {
        return Math.max(1, Math.min(Math.min(maxWorkers, WORKER_CAP), Runtime.getRuntime().availableProcessors()));
    }

    /**
     * Delay before retrying after the given failed attempt (1-based).
     */
    public Duration backoffAfter(int attempt) {
        return backoffBase.multipliedBy(1L << Math.max(0, attempt - 1));
    }
}
