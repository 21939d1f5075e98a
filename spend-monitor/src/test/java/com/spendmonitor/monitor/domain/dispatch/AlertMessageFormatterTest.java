package com.spendmonitor.monitor.domain.dispatch;

import static com.spendmonitor.monitor.test.fixtures.CostFixtures.SOME_INSTANT;
import static com.spendmonitor.monitor.test.fixtures.CostFixtures.SOME_THRESHOLD;
import static com.spendmonitor.monitor.test.fixtures.CostFixtures.analysis;
import static com.spendmonitor.monitor.test.fixtures.CostFixtures.analysisOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.spendmonitor.common.event.AlertLevel;
import com.spendmonitor.common.push.NotificationPayload;
import com.spendmonitor.monitor.domain.cost.CostAnalysis;
import com.spendmonitor.monitor.domain.enrichment.AIAnalysisResult;
import com.spendmonitor.monitor.domain.enrichment.Anomaly;
import com.spendmonitor.monitor.domain.enrichment.Priority;
import com.spendmonitor.monitor.domain.enrichment.Recommendation;
import com.spendmonitor.monitor.domain.enrichment.RecommendationCategory;
import com.spendmonitor.monitor.domain.enrichment.Severity;
import com.spendmonitor.monitor.domain.evaluation.AlertContext;
import com.spendmonitor.monitor.domain.evaluation.ThresholdEvaluator;
import com.spendmonitor.monitor.domain.exceptions.PayloadTooLargeException;
import com.spendmonitor.monitor.test.fixtures.MutableClock;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AlertMessageFormatterTest {

    private static final String SOME_ALERT_ID = "spend-alert-1773568800000-ABC123";

    private final AlertMessageFormatter formatter = new AlertMessageFormatter(new MutableClock(SOME_INSTANT));
    private final ThresholdEvaluator evaluator = new ThresholdEvaluator();

    @Test
    void shouldFormatSubjectWithExceedAmount() {
        var context = contextFor(analysisOf("15.50"));

        assertThat(formatter.formatSubject(context)).isEqualTo("AWS Spend Alert: $5.50 over budget");
    }

    @Test
    void shouldFormatCriticalMessageWithDefaultRecommendations() {
        var analysis = analysisOf("15.50");
        var context = contextFor(analysis);

        var message = formatter.formatMessage(analysis, context);

        assertThat(context.alertLevel()).isEqualTo(AlertLevel.CRITICAL);
        assertThat(message.lines()).startsWith("🚨 AWS Spend Alert - CRITICAL");
        assertThat(message.lines()).contains(
                "Current Spending: $15.50",
                "Threshold: $10.00",
                "Over Budget: $5.50 (55.0%)",
                "Projected Monthly: $31.00",
                "Period: Mar 1, 2026 - Mar 15, 2026",
                "1. Amazon EC2: $15.50 (100.0%)",
                "• Review your AWS resources and usage patterns",
                "Alert generated at: 2026-03-15 10:00:00 UTC");
        assertThat(message).doesNotContain("AI Analysis", "Anomalies Detected");
    }

    @Test
    void shouldIncludeAnalysisAnomaliesAndRecommendations() {
        var analysis = analysisOf("12.00");
        var context = contextFor(analysis)
                .withAnalysis(AIAnalysisResult.builder()
                        .summary("EC2 drives most of the spend")
                        .keyInsights(List.of("Compute grew 20% month over month"))
                        .confidenceScore(0.8)
                        .analysisTimestamp(SOME_INSTANT)
                        .modelUsed("amazon.titan-text-express-v1")
                        .build())
                .withInsights(
                        List.of(Anomaly.builder()
                                .service("Amazon EC2")
                                .severity(Severity.HIGH)
                                .description("Spend doubled since last month")
                                .confidenceScore(0.9)
                                .build()),
                        List.of(Recommendation.builder()
                                .category(RecommendationCategory.RIGHTSIZING)
                                .service("Amazon EC2")
                                .description("Downsize idle instances")
                                .estimatedSavings(new BigDecimal("3"))
                                .priority(Priority.HIGH)
                                .build()));

        var message = formatter.formatMessage(analysis, context);

        assertThat(message.lines()).startsWith("⚠️ AWS Spend Alert - WARNING");
        assertThat(message.lines()).contains(
                "AI Analysis (amazon.titan-text-express-v1, confidence 80%):",
                "EC2 drives most of the spend",
                "• Compute grew 20% month over month",
                "• [HIGH] Amazon EC2: Spend doubled since last month",
                "• Downsize idle instances (est. savings $3.00/month)");
        assertThat(message).doesNotContain("Review your AWS resources");
    }

    @Test
    void shouldFormatSmsWithTopService() {
        var analysis = analysisOf("15.50");

        assertThat(formatter.formatSmsMessage(analysis, contextFor(analysis))).isEqualTo(
                "AWS Spend Alert: $15.50 spent (over $10.00 threshold by $5.50). "
                        + "Top service: Amazon EC2 ($15.50). Projected monthly: $31.00");
    }

    @Test
    void shouldBuildCriticalPushPayload() {
        var analysis = analysisOf("15.50");

        var push = formatter.formatPush(analysis, contextFor(analysis), SOME_ALERT_ID);

        var aps = push.payload().aps();
        assertThat(aps.alert().title()).isEqualTo("AWS Spend Alert");
        assertThat(aps.alert().body()).isEqualTo("$15.50 spent - $5.50 over budget");
        assertThat(aps.alert().subtitle()).isEqualTo(AlertMessageFormatter.CRITICAL_SUBTITLE);
        assertThat(aps.sound()).isEqualTo(AlertMessageFormatter.CRITICAL_SOUND);
        assertThat(aps.badge()).isEqualTo(1);
        assertThat(push.payload().customData().alertId()).isEqualTo(SOME_ALERT_ID);
        assertThat(push.payload().customData().topService()).isEqualTo("Amazon EC2");
        assertThat(push.json()).contains("\"content-available\":1", SOME_ALERT_ID);
        assertThat(push.sizeBytes()).isPositive().isLessThanOrEqualTo(NotificationPayload.MAX_SERIALIZED_BYTES);
    }

    @Test
    void shouldUseDefaultSoundForWarnings() {
        var analysis = analysisOf("12.00");

        var push = formatter.formatPush(analysis, contextFor(analysis), SOME_ALERT_ID);

        assertThat(push.payload().aps().alert().subtitle()).isEqualTo(AlertMessageFormatter.WARNING_SUBTITLE);
        assertThat(push.payload().aps().sound()).isEqualTo(AlertMessageFormatter.DEFAULT_SOUND);
    }

    @Test
    void shouldGiveEachPayloadItsOwnAlertId() {
        var analysis = analysisOf("15.50");
        var context = contextFor(analysis);

        var first = formatter.formatPushPayload(analysis, context);
        var second = formatter.formatPushPayload(analysis, context);

        assertThat(first.customData().alertId()).startsWith("spend-alert-" + SOME_INSTANT.toEpochMilli() + "-");
        assertThat(first.customData().alertId()).isNotEqualTo(second.customData().alertId());
    }

    @Test
    void shouldRejectOversizePayloadInsteadOfTruncating() {
        var analysis = analysis(Map.of("x".repeat(5000), new BigDecimal("15.50")));

        assertThatThrownBy(() -> formatter.formatPush(analysis, contextFor(analysis), SOME_ALERT_ID))
                .isInstanceOfSatisfying(PayloadTooLargeException.class, e -> {
                    assertThat(e.getSize()).isGreaterThan(NotificationPayload.MAX_SERIALIZED_BYTES);
                    assertThat(e.getLimit()).isEqualTo(NotificationPayload.MAX_SERIALIZED_BYTES);
                });
    }

    private AlertContext contextFor(CostAnalysis analysis) {
        return evaluator.evaluate(analysis, SOME_THRESHOLD, BigDecimal.ONE).orElseThrow();
    }
}
