package com.paxkun.magpie.config;

import java.time.Duration;
import java.util.Set;

/**
 * Pooled image client settings, including its own retry on transient statuses.
 */
public record HttpSettings(int maxConnections,
                           int transportRetries,
                           Duration transportBackoff,
                           Duration responseTimeout,
                           int maxImageBytes) {

    public static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);
}
