package com.spendmonitor.monitor.domain.enrichment;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
