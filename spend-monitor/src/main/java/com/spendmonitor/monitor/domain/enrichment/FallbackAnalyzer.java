package com.spendmonitor.monitor.domain.enrichment;

import com.spendmonitor.monitor.domain.cost.CostAnalysis;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Deterministic stand-ins for every enrichment call. Pure arithmetic over the cost data,
 * so it cannot fail.
 */
@Component
public class FallbackAnalyzer {

    static final double FALLBACK_CONFIDENCE = 0.3;
    static final String TOTAL_SERVICE = "Total";

    private static final double ANOMALY_SPREADS = 2.0;
    private static final double MEDIUM_SPREADS = 3.0;
    private static final double HIGH_SPREADS = 4.0;
    private static final double MAX_ANOMALY_CONFIDENCE = 0.7;
    private static final double MIN_ANOMALY_SHARE = 0.05;
    private static final double MIN_RECOMMENDATION_SHARE = 0.10;

    public AIAnalysisResult analysis(CostAnalysis analysis, FallbackReason reason, Instant analysedAt) {
        var insights = new ArrayList<String>();
        topService(analysis).ifPresent(top -> insights.add("Top cost driver: " + top.getKey() + " ($"
                + money(top.getValue()) + ", " + percent(share(top.getValue(), analysis.totalCost())) + " of total)"));
        insights.add("AI analysis unavailable - using basic cost breakdown");
        insights.add("Consider reviewing high-cost services for optimization opportunities");

        return AIAnalysisResult.builder()
                .summary("Current spending is $" + money(analysis.totalCost())
                        + " with projected monthly cost of $" + money(analysis.projectedMonthly()) + ".")
                .keyInsights(insights)
                .confidenceScore(FALLBACK_CONFIDENCE)
                .analysisTimestamp(analysedAt)
                .modelUsed(AIAnalysisResult.FALLBACK_MODEL)
                .processingCost(BigDecimal.ZERO)
                .fallbackReason(reason)
                .build();
    }

    /**
     * Flags services whose current cost sits more than two spreads above their historical
     * mean, where spread is the larger of the standard deviation, a quarter of the mean and
     * one cent. Without history there is no baseline and nothing is flagged.
     */
    public AnomalyResult anomalies(CostAnalysis current, List<CostAnalysis> history, int maxAnomalies) {
        if (history.isEmpty()) {
            return AnomalyResult.of(List.of(), AIAnalysisResult.FALLBACK_MODEL);
        }
        var candidates = new ArrayList<Candidate>();
        check(TOTAL_SERVICE, current.totalCost(), history, CostAnalysis::totalCost)
                .ifPresent(candidates::add);
        for (var entry : current.serviceBreakdown().entrySet()) {
            if (share(entry.getValue(), current.totalCost()) < MIN_ANOMALY_SHARE) {
                continue;
            }
            var service = entry.getKey();
            check(service, entry.getValue(), history,
                    h -> h.serviceBreakdown().getOrDefault(service, BigDecimal.ZERO))
                    .ifPresent(candidates::add);
        }

        var anomalies = candidates.stream()
                .sorted(Comparator.comparingDouble(Candidate::spreads).reversed()
                        .thenComparing(Candidate::service))
                .limit(maxAnomalies)
                .map(FallbackAnalyzer::toAnomaly)
                .toList();
        return AnomalyResult.of(anomalies, AIAnalysisResult.FALLBACK_MODEL);
    }

    /**
     * Category heuristics for every service above ten percent of the total.
     */
    public List<Recommendation> recommendations(CostAnalysis analysis) {
        var recommendations = new ArrayList<Recommendation>();
        analysis.serviceBreakdown().entrySet().stream()
                .filter(e -> share(e.getValue(), analysis.totalCost()) > MIN_RECOMMENDATION_SHARE)
                .sorted(Map.Entry.<String, BigDecimal>comparingByValue().reversed())
                .forEach(e -> recommendations.addAll(heuristicsFor(e.getKey(), e.getValue(),
                        share(e.getValue(), analysis.totalCost()))));
        return recommendations;
    }

    private static List<Recommendation> heuristicsFor(String service, BigDecimal cost, double share) {
        var name = service.toLowerCase(Locale.ROOT);
        var priority = share > 0.30 ? Priority.HIGH : share > 0.15 ? Priority.MEDIUM : Priority.LOW;
        if (name.contains("ec2") || name.contains("compute")) {
            return List.of(
                    recommendation(RecommendationCategory.RIGHTSIZING, service, cost, priority, ImplementationComplexity.MEDIUM,
                            "Review instance utilization for " + service + " and downsize underused instances"),
                    recommendation(RecommendationCategory.RESERVED_INSTANCES, service, cost, priority, ImplementationComplexity.EASY,
                            "Cover steady " + service + " usage with reserved capacity or a savings plan"));
        }
        if (name.contains("s3") || name.contains("storage") || name.contains("ebs")) {
            return List.of(recommendation(RecommendationCategory.STORAGE_OPTIMIZATION, service, cost, priority,
                    ImplementationComplexity.EASY,
                    "Apply lifecycle policies and cheaper storage classes to infrequently accessed " + service + " data"));
        }
        if (name.contains("rds") || name.contains("database") || name.contains("dynamodb")) {
            return List.of(
                    recommendation(RecommendationCategory.RIGHTSIZING, service, cost, priority, ImplementationComplexity.MEDIUM,
                            "Check " + service + " capacity against actual load and scale down idle resources"),
                    recommendation(RecommendationCategory.RESERVED_INSTANCES, service, cost, priority, ImplementationComplexity.EASY,
                            "Reserve capacity for long-running " + service + " workloads"));
        }
        return List.of(recommendation(RecommendationCategory.OTHER, service, cost, priority, ImplementationComplexity.MEDIUM,
                "Review " + service + " usage for resources that are no longer needed"));
    }

    private static Recommendation recommendation(
            RecommendationCategory category,
            String service,
            BigDecimal cost,
            Priority priority,
            ImplementationComplexity complexity,
            String description) {
        return Recommendation.builder()
                .category(category)
                .service(service)
                .description(description)
                .estimatedSavings(cost.multiply(category.typicalSavingsRatio()).setScale(2, RoundingMode.HALF_UP))
                .priority(priority)
                .implementationComplexity(complexity)
                .build();
    }

    private static Optional<Candidate> check(
            String service, BigDecimal current, List<CostAnalysis> history, Function<CostAnalysis, BigDecimal> valueOf) {
        var values = history.stream().map(valueOf).mapToDouble(BigDecimal::doubleValue).toArray();
        double mean = 0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.length;
        double variance = 0;
        for (double v : values) {
            variance += (v - mean) * (v - mean);
        }
        double sigma = Math.sqrt(variance / values.length);
        double spread = Math.max(sigma, Math.max(0.25 * mean, 0.01));
        double spreads = (current.doubleValue() - mean) / spread;
        if (spreads <= ANOMALY_SPREADS) {
            return Optional.empty();
        }
        return Optional.of(new Candidate(service, current, mean, spreads));
    }

    private static Anomaly toAnomaly(Candidate candidate) {
        var severity = candidate.spreads() >= HIGH_SPREADS
                ? Severity.HIGH
                : candidate.spreads() >= MEDIUM_SPREADS ? Severity.MEDIUM : Severity.LOW;
        return Anomaly.builder()
                .service(candidate.service())
                .severity(severity)
                .description(candidate.service() + " cost of $" + money(candidate.current())
                        + " is well above its historical average of $"
                        + money(BigDecimal.valueOf(candidate.mean())))
                .confidenceScore(Math.min(MAX_ANOMALY_CONFIDENCE, 0.3 + 0.1 * candidate.spreads()))
                .suggestedAction("Review recent " + candidate.service() + " usage changes and new resources")
                .build();
    }

    private static Optional<Map.Entry<String, BigDecimal>> topService(CostAnalysis analysis) {
        return analysis.serviceBreakdown().entrySet().stream()
                .max(Map.Entry.<String, BigDecimal>comparingByValue()
                        .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()));
    }

    private static double share(BigDecimal cost, BigDecimal total) {
        if (total == null || total.signum() == 0) {
            return 0;
        }
        return cost.divide(total, MathContext.DECIMAL64).doubleValue();
    }

    private static String money(BigDecimal amount) {
        return amount == null ? "0.00" : amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String percent(double share) {
        return String.format(Locale.ROOT, "%.1f%%", share * 100);
    }

    private record Candidate(String service, BigDecimal current, double mean, double spreads) {}
}
