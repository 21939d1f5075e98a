package com.spendmonitor.monitor.domain.evaluation;

import static com.spendmonitor.monitor.test.fixtures.CostFixtures.SOME_THRESHOLD;
import static com.spendmonitor.monitor.test.fixtures.CostFixtures.analysis;
import static com.spendmonitor.monitor.test.fixtures.CostFixtures.analysisBuilder;
import static com.spendmonitor.monitor.test.fixtures.CostFixtures.analysisOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.spendmonitor.common.event.AlertLevel;
import com.spendmonitor.monitor.domain.cost.BillingPeriod;
import com.spendmonitor.monitor.domain.cost.ServiceCost;
import com.spendmonitor.monitor.domain.exceptions.ValidationException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ThresholdEvaluatorTest {

    private final ThresholdEvaluator evaluator = new ThresholdEvaluator();

    @Test
    void shouldNotAlertWhenTotalEqualsThreshold() {
        var result = evaluator.evaluate(analysisOf("10.00"), SOME_THRESHOLD, BigDecimal.ZERO);

        assertThat(result).isEmpty();
    }

    @Test
    void shouldNotAlertBelowThreshold() {
        var result = evaluator.evaluate(analysisOf("9.99"), SOME_THRESHOLD, BigDecimal.ZERO);

        assertThat(result).isEmpty();
    }

    @Test
    void shouldRaiseWarningJustAboveThreshold() {
        var context = evaluator.evaluate(analysisOf("10.01"), SOME_THRESHOLD, BigDecimal.ZERO).orElseThrow();

        assertThat(context.alertLevel()).isEqualTo(AlertLevel.WARNING);
        assertThat(context.exceedAmount()).isEqualByComparingTo("0.01");
        assertThat(context.percentageOver()).isEqualByComparingTo("0.10");
    }

    @Test
    void shouldRaiseWarningAtExactlyFiftyPercentOver() {
        var context = evaluator.evaluate(analysisOf("15.00"), SOME_THRESHOLD, BigDecimal.ZERO).orElseThrow();

        assertThat(context.alertLevel()).isEqualTo(AlertLevel.WARNING);
        assertThat(context.percentageOver()).isEqualByComparingTo("50");
    }

    @Test
    void shouldRaiseCriticalWhenMoreThanFiftyPercentOver() {
        var context = evaluator.evaluate(analysisOf("15.50"), SOME_THRESHOLD, BigDecimal.ZERO).orElseThrow();

        assertThat(context.alertLevel()).isEqualTo(AlertLevel.CRITICAL);
        assertThat(context.exceedAmount()).isEqualByComparingTo("5.50");
        assertThat(context.percentageOver()).isEqualByComparingTo("55");
    }

    @Test
    void shouldRaiseCriticalWhenOverageRoundsDownToFiftyPercent() {
        var context = evaluator.evaluate(analysisOf("15.0004"), SOME_THRESHOLD, BigDecimal.ZERO).orElseThrow();

        assertThat(context.alertLevel()).isEqualTo(AlertLevel.CRITICAL);
        assertThat(context.percentageOver()).isEqualByComparingTo("50.00");
    }

    @Test
    void shouldRaiseCriticalAtDoubleTheThreshold() {
        var context = evaluator.evaluate(analysisOf("20.00"), SOME_THRESHOLD, BigDecimal.ZERO).orElseThrow();

        assertThat(context.alertLevel()).isEqualTo(AlertLevel.CRITICAL);
        assertThat(context.exceedAmount()).isEqualByComparingTo("10.00");
        assertThat(context.percentageOver()).isEqualByComparingTo("100");
    }

    @Test
    void shouldRankServicesByCostDescendingWithPercentages() {
        var costs = analysis(Map.of(
                "Amazon S3", new BigDecimal("5.00"),
                "Amazon EC2", new BigDecimal("12.00"),
                "AWS Lambda", new BigDecimal("3.00")));

        var context = evaluator.evaluate(costs, SOME_THRESHOLD, BigDecimal.ZERO).orElseThrow();

        assertThat(context.topServices()).containsExactly(
                new ServiceCost("Amazon EC2", new BigDecimal("12.00"), new BigDecimal("60.00")),
                new ServiceCost("Amazon S3", new BigDecimal("5.00"), new BigDecimal("25.00")),
                new ServiceCost("AWS Lambda", new BigDecimal("3.00"), new BigDecimal("15.00")));
        assertThat(context.topService()).map(ServiceCost::serviceName).contains("Amazon EC2");
    }

    @Test
    void shouldBreakCostTiesByServiceName() {
        var costs = analysis(Map.of(
                "Zeta", new BigDecimal("6.00"),
                "Alpha", new BigDecimal("6.00")));

        var context = evaluator.evaluate(costs, SOME_THRESHOLD, BigDecimal.ZERO).orElseThrow();

        assertThat(context.topServices()).extracting(ServiceCost::serviceName).containsExactly("Alpha", "Zeta");
    }

    @Test
    void shouldFoldServicesBelowMinimumIntoOther() {
        var costs = analysis(Map.of(
                "Amazon EC2", new BigDecimal("14.00"),
                "Amazon SQS", new BigDecimal("0.40"),
                "Amazon SNS", new BigDecimal("0.60")));

        var context = evaluator.evaluate(costs, SOME_THRESHOLD, BigDecimal.ONE).orElseThrow();

        assertThat(context.topServices()).extracting(ServiceCost::serviceName)
                .containsExactly("Amazon EC2", ThresholdEvaluator.OTHER_BUCKET);
        assertThat(context.topServices().get(1).cost()).isEqualByComparingTo("1.00");
    }

    @Test
    void shouldLimitToTopN() {
        var costs = analysis(Map.of(
                "A", new BigDecimal("4.00"),
                "B", new BigDecimal("3.00"),
                "C", new BigDecimal("2.00"),
                "D", new BigDecimal("2.50")));

        var context = evaluator.evaluate(costs, SOME_THRESHOLD, BigDecimal.ZERO, 2).orElseThrow();

        assertThat(context.topServices()).extracting(ServiceCost::serviceName).containsExactly("A", "B");
    }

    @Test
    void shouldRejectNonPositiveThreshold() {
        assertThatThrownBy(() -> evaluator.evaluate(analysisOf("5.00"), BigDecimal.ZERO, BigDecimal.ZERO))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Threshold");
    }

    @Test
    void shouldRejectNegativeServiceCost() {
        var costs = analysisBuilder(new BigDecimal("5.00"))
                .serviceBreakdown(Map.of("A", new BigDecimal("6.00"), "B", new BigDecimal("-1.00")))
                .build();

        assertThatThrownBy(() -> evaluator.evaluate(costs, SOME_THRESHOLD, BigDecimal.ZERO))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Negative cost");
    }

    @Test
    void shouldRejectBreakdownThatDoesNotSumToTotal() {
        var costs = analysisBuilder(new BigDecimal("20.00"))
                .serviceBreakdown(Map.of("A", new BigDecimal("12.00")))
                .build();

        assertThatThrownBy(() -> evaluator.evaluate(costs, SOME_THRESHOLD, BigDecimal.ZERO))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("sums to");
    }

    @Test
    void shouldAcceptRoundingDifferenceWithinTolerance() {
        var costs = analysisBuilder(new BigDecimal("20.01"))
                .serviceBreakdown(Map.of("A", new BigDecimal("12.00"), "B", new BigDecimal("8.00")))
                .build();

        assertThat(evaluator.evaluate(costs, SOME_THRESHOLD, BigDecimal.ZERO)).isPresent();
    }

    @Test
    void shouldRejectInvertedPeriod() {
        var costs = analysisBuilder(new BigDecimal("12.00"))
                .serviceBreakdown(Map.of("A", new BigDecimal("12.00")))
                .period(new BillingPeriod(LocalDate.of(2026, 3, 10), LocalDate.of(2026, 3, 1)))
                .build();

        assertThatThrownBy(() -> evaluator.evaluate(costs, SOME_THRESHOLD, BigDecimal.ZERO))
                .isInstanceOf(ValidationException.class);
    }
}
