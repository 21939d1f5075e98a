package com.spendmonitor.monitor.domain.enrichment;

import java.util.List;

public record AnomalyResult(boolean anomaliesDetected, List<Anomaly> anomalies, String modelUsed) {

    public AnomalyResult {
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
    }

    public static AnomalyResult of(List<Anomaly> anomalies, String modelUsed) {
        return new AnomalyResult(!anomalies.isEmpty(), anomalies, modelUsed);
    }
}
