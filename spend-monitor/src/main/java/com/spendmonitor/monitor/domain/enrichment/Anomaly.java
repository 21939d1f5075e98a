package com.spendmonitor.monitor.domain.enrichment;

import lombok.Builder;

@Builder(toBuilder = true)
public record Anomaly(
        String service,
        Severity severity,
        String description,
        double confidenceScore,
        String suggestedAction) {

    public Anomaly {
        confidenceScore = Math.max(0.0, Math.min(1.0, confidenceScore));
    }
}
