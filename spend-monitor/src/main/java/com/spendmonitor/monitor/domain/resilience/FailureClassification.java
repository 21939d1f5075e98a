package com.spendmonitor.monitor.domain.resilience;

public enum FailureClassification {
    RETRYABLE,
    FATAL
}
