package com.spendmonitor.monitor.test.fixtures;

import com.spendmonitor.monitor.domain.cost.BillingPeriod;
import com.spendmonitor.monitor.domain.cost.CostAnalysis;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CostFixtures {

    public static final Instant SOME_INSTANT = Instant.parse("2026-03-15T10:00:00Z");
    public static final BillingPeriod SOME_PERIOD =
            new BillingPeriod(LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 15));
    public static final BigDecimal SOME_THRESHOLD = new BigDecimal("10.00");

    public static CostAnalysis analysis(Map<String, BigDecimal> breakdown) {
        var total = breakdown.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return analysisBuilder(total).serviceBreakdown(breakdown).build();
    }

    public static CostAnalysis analysisOf(String total) {
        return analysis(Map.of("Amazon EC2", new BigDecimal(total)));
    }

    public static CostAnalysis.CostAnalysisBuilder analysisBuilder(BigDecimal total) {
        return CostAnalysis.builder()
                .totalCost(total)
                .serviceBreakdown(Map.of())
                .period(SOME_PERIOD)
                .projectedMonthly(total.multiply(BigDecimal.valueOf(2)))
                .currency("USD")
                .lastUpdated(SOME_INSTANT);
    }
}
