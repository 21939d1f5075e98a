package com.spendmonitor.monitor.domain.exceptions;

import java.time.Duration;

public class RateLimitExceededException extends SpendMonitorException {

    private RateLimitExceededException(String message) {
        super(message);
    }

    public static RateLimitExceededException enrichmentWindow(int maxCalls, Duration window, Duration wait) {
        return new RateLimitExceededException("Enrichment limit of " + maxCalls + " calls per "
                + window.toSeconds() + "s reached, next slot in " + wait.toMillis() + "ms exceeds the deadline");
    }

    public static RateLimitExceededException registrationLimit(int max) {
        return new RateLimitExceededException("Device registration limit: " + max + " per minute");
    }

    public static RateLimitExceededException throttled(String operation) {
        return new RateLimitExceededException(operation + " was throttled by the backend");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RATE_LIMITED;
    }
}
