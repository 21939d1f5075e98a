package com.spendmonitor.monitor.domain.evaluation;

import com.spendmonitor.common.event.AlertLevel;
import com.spendmonitor.monitor.domain.cost.ServiceCost;
import com.spendmonitor.monitor.domain.enrichment.AIAnalysisResult;
import com.spendmonitor.monitor.domain.enrichment.Anomaly;
import com.spendmonitor.monitor.domain.enrichment.Recommendation;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import lombok.Builder;

/**
 * Derived view of a threshold breach. Built per run, never persisted.
 */
@Builder(toBuilder = true)
public record AlertContext(
        BigDecimal threshold,
        BigDecimal exceedAmount,
        BigDecimal percentageOver,
        List<ServiceCost> topServices,
        AlertLevel alertLevel,
        AIAnalysisResult aiAnalysis,
        List<Anomaly> anomalies,
        List<Recommendation> recommendations) {

    public AlertContext {
        topServices = topServices == null ? List.of() : List.copyOf(topServices);
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public Optional<ServiceCost> topService() {
        return topServices.isEmpty() ? Optional.empty() : Optional.of(topServices.get(0));
    }

    public Optional<AIAnalysisResult> analysis() {
        return Optional.ofNullable(aiAnalysis);
    }

    public AlertContext withAnalysis(AIAnalysisResult analysis) {
        return toBuilder().aiAnalysis(analysis).build();
    }

    public AlertContext withInsights(List<Anomaly> anomalies, List<Recommendation> recommendations) {
        return toBuilder().anomalies(anomalies).recommendations(recommendations).build();
    }
}
