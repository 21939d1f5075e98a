package com.spendmonitor.monitor.domain.enrichment;

import java.math.BigDecimal;

/**
 * Optimization categories with the share of a service's cost they typically save.
 */
public enum RecommendationCategory {
    RIGHTSIZING(new BigDecimal("0.30")),
    RESERVED_INSTANCES(new BigDecimal("0.40")),
    SPOT_INSTANCES(new BigDecimal("0.60")),
    STORAGE_OPTIMIZATION(new BigDecimal("0.25")),
    OTHER(new BigDecimal("0.15"));

    private final BigDecimal typicalSavingsRatio;

    RecommendationCategory(BigDecimal typicalSavingsRatio) {
        this.typicalSavingsRatio = typicalSavingsRatio;
    }

    public BigDecimal typicalSavingsRatio() {
        return typicalSavingsRatio;
    }

    public static RecommendationCategory parse(String value) {
        if (value == null) {
            return OTHER;
        }
        var normalized = value.trim().toUpperCase().replace(' ', '_').replace('-', '_');
        for (var category : values()) {
            if (category.name().equals(normalized)) {
                return category;
            }
        }
        return OTHER;
    }
}
