package com.spendmonitor.monitor.domain.pipeline;

public enum RunStatus {
    COMPLETED,
    NO_ALERT,
    FAILED,
    CANCELLED
}
