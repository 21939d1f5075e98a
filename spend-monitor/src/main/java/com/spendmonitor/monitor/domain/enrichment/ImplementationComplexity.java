package com.spendmonitor.monitor.domain.enrichment;

public enum ImplementationComplexity {
    EASY,
    MEDIUM,
    COMPLEX
}
