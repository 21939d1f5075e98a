package com.spendmonitor.monitor.domain.cost;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;

/**
 * Spend snapshot for one billing period. The per-service amounts are expected to sum
 * to {@code totalCost} within rounding tolerance.
 */
@Builder(toBuilder = true)
public record CostAnalysis(
        BigDecimal totalCost,
        Map<String, BigDecimal> serviceBreakdown,
        BillingPeriod period,
        BigDecimal projectedMonthly,
        String currency,
        Instant lastUpdated) {

    public CostAnalysis {
        serviceBreakdown = serviceBreakdown == null ? Map.of() : Map.copyOf(serviceBreakdown);
    }
}
