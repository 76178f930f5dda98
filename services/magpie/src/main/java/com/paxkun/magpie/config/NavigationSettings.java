package com.paxkun.magpie.config;

import java.time.Duration;

public record NavigationSettings(int maxAttempts, Duration timeout, boolean headless) {
}
