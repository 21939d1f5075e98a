package com.spendmonitor.monitor.domain.enrichment;

import com.spendmonitor.monitor.domain.cost.CostAnalysis;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Fills in missing savings estimates, caps them at 80% of the service's cost, adjusts
 * priority by impact and orders recommendations by priority, then savings.
 */
@Component
public class RecommendationRanker {

    static final BigDecimal MAX_SAVINGS_RATIO = new BigDecimal("0.80");
    private static final BigDecimal HIGH_IMPACT_SHARE = new BigDecimal("0.10");
    private static final BigDecimal MEDIUM_IMPACT_SHARE = new BigDecimal("0.05");

    private static final Comparator<Recommendation> BY_PRIORITY_THEN_SAVINGS =
            Comparator.comparing(Recommendation::priority, Comparator.reverseOrder())
                    .thenComparing(Recommendation::estimatedSavings,
                            Comparator.nullsLast(Comparator.reverseOrder()));

    public List<Recommendation> rank(List<Recommendation> recommendations, CostAnalysis analysis, int limit) {
        return recommendations.stream()
                .map(r -> enhance(r, analysis))
                .sorted(BY_PRIORITY_THEN_SAVINGS)
                .limit(limit)
                .toList();
    }

    Recommendation enhance(Recommendation recommendation, CostAnalysis analysis) {
        var serviceCost = analysis.serviceBreakdown().get(recommendation.service());
        var savings = recommendation.estimatedSavings();
        if (serviceCost != null && serviceCost.signum() > 0) {
            if (savings == null) {
                savings = serviceCost.multiply(recommendation.category().typicalSavingsRatio());
            }
            var cap = serviceCost.multiply(MAX_SAVINGS_RATIO);
            if (savings.compareTo(cap) > 0) {
                savings = cap;
            }
        }
        if (savings != null) {
            savings = savings.setScale(2, RoundingMode.HALF_UP);
        }

        var priority = recommendation.priority() == null ? Priority.MEDIUM : recommendation.priority();
        if (savings != null && analysis.totalCost().signum() > 0) {
            var impact = savings.divide(analysis.totalCost(), MathContext.DECIMAL64);
            if (impact.compareTo(HIGH_IMPACT_SHARE) > 0) {
                priority = Priority.HIGH;
            } else if (impact.compareTo(MEDIUM_IMPACT_SHARE) > 0 && priority == Priority.LOW) {
                priority = Priority.MEDIUM;
            }
        }
        if (priority == Priority.HIGH
                && recommendation.implementationComplexity() == ImplementationComplexity.COMPLEX
                && (savings == null || savings.divide(analysis.totalCost().max(BigDecimal.ONE), MathContext.DECIMAL64)
                        .compareTo(MEDIUM_IMPACT_SHARE) <= 0)) {
            priority = Priority.MEDIUM;
        }

        return recommendation.toBuilder()
                .estimatedSavings(savings)
                .priority(priority)
                .build();
    }
}
