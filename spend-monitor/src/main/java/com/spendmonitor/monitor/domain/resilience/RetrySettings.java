package com.spendmonitor.monitor.domain.resilience;

import java.time.Duration;
import lombok.Builder;

@Builder(toBuilder = true)
public record RetrySettings(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        double multiplier,
        double jitterRatio) {

    public RetrySettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay >= 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        if (jitterRatio < 0.0 || jitterRatio >= 1.0) {
            throw new IllegalArgumentException("jitterRatio must be in [0, 1)");
        }
    }

    public static RetrySettings defaults() {
        return new RetrySettings(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, 0.25);
    }
}
