package com.spendmonitor.monitor.domain.evaluation;

import com.spendmonitor.common.event.AlertLevel;
import com.spendmonitor.monitor.domain.cost.CostAnalysis;
import com.spendmonitor.monitor.domain.cost.ServiceCost;
import com.spendmonitor.monitor.domain.exceptions.ValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns a cost breakdown into an alert decision.
 *
 * <p>An alert fires only when the total is strictly above the threshold. Services below
 * the minimum service cost are folded into a single {@value #OTHER_BUCKET} entry before
 * ranking, so the top list never hides spend.
 */
@Slf4j
@Component
public class ThresholdEvaluator {

    public static final String OTHER_BUCKET = "Other";
    public static final int DEFAULT_TOP_N = 5;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal CRITICAL_PERCENTAGE_OVER = BigDecimal.valueOf(50);
    private static final BigDecimal TOLERANCE_PER_ENTRY = new BigDecimal("0.01");

    private static final Comparator<ServiceCost> BY_COST_DESC_THEN_NAME =
            Comparator.comparing(ServiceCost::cost, Comparator.reverseOrder())
                    .thenComparing(ServiceCost::serviceName);

    public Optional<AlertContext> evaluate(CostAnalysis analysis, BigDecimal threshold, BigDecimal minServiceCost) {
        return evaluate(analysis, threshold, minServiceCost, DEFAULT_TOP_N);
    }

    public Optional<AlertContext> evaluate(
            CostAnalysis analysis, BigDecimal threshold, BigDecimal minServiceCost, int topN) {
        validate(analysis, threshold, minServiceCost, topN);

        var total = analysis.totalCost();
        if (total.compareTo(threshold) <= 0) {
            log.debug("No alert: total={} threshold={}", total, threshold);
            return Optional.empty();
        }

        var exceedAmount = total.subtract(threshold);
        var percentageOver = exceedAmount.multiply(HUNDRED).divide(threshold, 2, RoundingMode.HALF_UP);
        // the level is decided on exact amounts; percentageOver is rounded for reporting only
        var critical = exceedAmount.multiply(HUNDRED).compareTo(threshold.multiply(CRITICAL_PERCENTAGE_OVER)) > 0;
        var level = critical ? AlertLevel.CRITICAL : AlertLevel.WARNING;

        var context = AlertContext.builder()
                .threshold(threshold)
                .exceedAmount(exceedAmount)
                .percentageOver(percentageOver)
                .topServices(rankServices(analysis.serviceBreakdown(), total, minServiceCost, topN))
                .alertLevel(level)
                .build();
        log.info("Threshold exceeded: total={} threshold={} percentageOver={} level={}",
                total, threshold, percentageOver, level);
        return Optional.of(context);
    }

    List<ServiceCost> rankServices(
            Map<String, BigDecimal> breakdown, BigDecimal total, BigDecimal minServiceCost, int topN) {
        var folded = new TreeMap<String, BigDecimal>();
        var other = BigDecimal.ZERO;
        for (var entry : breakdown.entrySet()) {
            if (entry.getValue().compareTo(minServiceCost) < 0) {
                other = other.add(entry.getValue());
            } else {
                folded.merge(entry.getKey(), entry.getValue(), BigDecimal::add);
            }
        }
        if (other.signum() > 0) {
            folded.merge(OTHER_BUCKET, other, BigDecimal::add);
        }

        return folded.entrySet().stream()
                .map(e -> new ServiceCost(e.getKey(), e.getValue(), percentageOf(e.getValue(), total)))
                .sorted(BY_COST_DESC_THEN_NAME)
                .limit(topN)
                .toList();
    }

    private static BigDecimal percentageOf(BigDecimal cost, BigDecimal total) {
        return cost.multiply(HUNDRED).divide(total, 2, RoundingMode.HALF_UP);
    }

    private static void validate(CostAnalysis analysis, BigDecimal threshold, BigDecimal minServiceCost, int topN) {
        if (threshold == null || threshold.signum() <= 0) {
            throw ValidationException.of("Threshold must be greater than zero");
        }
        if (minServiceCost == null || minServiceCost.signum() < 0) {
            throw ValidationException.of("Minimum service cost must not be negative");
        }
        if (topN < 1) {
            throw ValidationException.of("Top service count must be at least 1");
        }
        if (analysis.period() == null || !analysis.period().isValid()) {
            throw ValidationException.of("Cost analysis has no valid billing period");
        }
        if (analysis.totalCost() == null || analysis.totalCost().signum() < 0) {
            throw ValidationException.of("Total cost must not be negative");
        }
        var sum = BigDecimal.ZERO;
        for (var entry : analysis.serviceBreakdown().entrySet()) {
            if (entry.getValue().signum() < 0) {
                throw ValidationException.of("Negative cost for service " + entry.getKey());
            }
            sum = sum.add(entry.getValue());
        }
        var tolerance = TOLERANCE_PER_ENTRY.multiply(BigDecimal.valueOf(Math.max(1, analysis.serviceBreakdown().size())));
        if (sum.subtract(analysis.totalCost()).abs().compareTo(tolerance) > 0) {
            throw ValidationException.of("Service breakdown sums to " + sum.toPlainString()
                    + " but total cost is " + analysis.totalCost().toPlainString());
        }
    }
}
