package com.spendmonitor.monitor.domain.enrichment;

public enum Priority {
    LOW,
    MEDIUM,
    HIGH
}
