package com.spendmonitor.monitor.domain.enrichment;

import com.spendmonitor.monitor.domain.cost.CostAnalysis;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Re-weights model-reported anomaly confidence against the data it was derived from and
 * drops the ones that end up below the minimum confidence.
 */
@Component
public class AnomalyScorer {

    public List<Anomaly> score(
            List<Anomaly> anomalies, CostAnalysis current, List<CostAnalysis> history, double minConfidence) {
        return anomalies.stream()
                .map(a -> a.toBuilder().confidenceScore(adjust(a, current, history)).build())
                .filter(a -> a.confidenceScore() >= minConfidence)
                .sorted(Comparator.comparingDouble(Anomaly::confidenceScore).reversed())
                .toList();
    }

    double adjust(Anomaly anomaly, CostAnalysis current, List<CostAnalysis> history) {
        double confidence = anomaly.confidenceScore();
        var cost = current.serviceBreakdown().getOrDefault(anomaly.service(), BigDecimal.ZERO).doubleValue();

        if (history.isEmpty()) {
            confidence -= 0.2;
        } else {
            confidence += 0.2;
            double mean = history.stream()
                    .map(h -> h.serviceBreakdown().getOrDefault(anomaly.service(), BigDecimal.ZERO))
                    .mapToDouble(BigDecimal::doubleValue)
                    .average()
                    .orElse(0);
            if (mean > 0) {
                double deviation = Math.abs(cost - mean) / mean;
                if (deviation > 2) {
                    confidence += 0.3;
                } else if (deviation > 1) {
                    confidence += 0.1;
                }
            }
        }

        if (current.totalCost().signum() > 0) {
            double share = BigDecimal.valueOf(cost).divide(current.totalCost(), MathContext.DECIMAL64).doubleValue();
            if (share > 0.3) {
                confidence += 0.2;
            } else if (share > 0.1) {
                confidence += 0.1;
            } else if (share < 0.01) {
                confidence -= 0.3;
            }
        }

        if (anomaly.severity() == Severity.HIGH) {
            confidence += 0.1;
        } else if (anomaly.severity() == Severity.LOW) {
            confidence -= 0.1;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
