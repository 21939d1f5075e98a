package com.spendmonitor.monitor.domain.exceptions;

public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    TRANSIENT,
    RATE_LIMITED,
    COST_CAP,
    DEADLINE_EXCEEDED,
    CANCELLED,
    RETRY_EXHAUSTED,
    FATAL
}
