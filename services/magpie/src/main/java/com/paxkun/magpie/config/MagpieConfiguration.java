package com.paxkun.magpie.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Binds {@code magpie.*} properties into the settings records handed to each stage.
 */
@Configuration
public class MagpieConfiguration {

    @Bean
    public AcquisitionSettings acquisitionSettings(
            @Value("${magpie.acquisition.max-workers:20}") int maxWorkers,
            @Value("${magpie.acquisition.max-attempts:3}") int maxAttempts,
            @Value("${magpie.acquisition.backoff-base-ms:1000}") long backoffBaseMs) {
        return new AcquisitionSettings(maxWorkers, maxAttempts, Duration.ofMillis(backoffBaseMs));
    }

    @Bean
    public HttpSettings httpSettings(
            @Value("${magpie.http.max-connections:20}") int maxConnections,
            @Value("${magpie.http.transport-retries:5}") int transportRetries,
            @Value("${magpie.http.transport-backoff-ms:1000}") long transportBackoffMs,
            @Value("${magpie.http.response-timeout-seconds:20}") long responseTimeoutSeconds,
            @Value("${magpie.http.max-image-bytes:33554432}") int maxImageBytes) {
        return new HttpSettings(
                maxConnections,
                transportRetries,
                Duration.ofMillis(transportBackoffMs),
                Duration.ofSeconds(responseTimeoutSeconds),
                maxImageBytes);
    }

    @Bean
    public NavigationSettings navigationSettings(
            @Value("${magpie.navigation.max-attempts:3}") int maxAttempts,
            @Value("${magpie.navigation.timeout-seconds:15}") long timeoutSeconds,
            @Value("${magpie.browser.headless:true}") boolean headless) {
        return new NavigationSettings(maxAttempts, Duration.ofSeconds(timeoutSeconds), headless);
    }
}
