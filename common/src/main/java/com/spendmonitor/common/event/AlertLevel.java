package com.spendmonitor.common.event;

public enum AlertLevel {
    WARNING,
    CRITICAL
}
