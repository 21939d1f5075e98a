package com.spendmonitor.monitor.domain.enrichment;

import java.math.BigDecimal;
import lombok.Builder;

/**
 * Cost optimization suggestion. {@code estimatedSavings} is either absent or positive.
 */
@Builder(toBuilder = true)
public record Recommendation(
        RecommendationCategory category,
        String service,
        String description,
        BigDecimal estimatedSavings,
        Priority priority,
        ImplementationComplexity implementationComplexity) {

    public Recommendation {
        if (estimatedSavings != null && estimatedSavings.signum() <= 0) {
            estimatedSavings = null;
        }
    }
}
