package com.spendmonitor.monitor.domain.dispatch;

import com.spendmonitor.common.event.AlertLevel;
import com.spendmonitor.common.id.IdGenerator;
import com.spendmonitor.common.json.JacksonConfig;
import com.spendmonitor.common.push.NotificationPayload;
import com.spendmonitor.monitor.domain.cost.BillingPeriod;
import com.spendmonitor.monitor.domain.cost.CostAnalysis;
import com.spendmonitor.monitor.domain.cost.ServiceCost;
import com.spendmonitor.monitor.domain.enrichment.AIAnalysisResult;
import com.spendmonitor.monitor.domain.evaluation.AlertContext;
import com.spendmonitor.monitor.domain.exceptions.PayloadTooLargeException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Renders an alert for each channel: the long text for the broadcast, a short SMS form
 * and the APNs payload.
 */
@Component
@RequiredArgsConstructor
public class AlertMessageFormatter {

    static final String PUSH_TITLE = "AWS Spend Alert";
    static final String CRITICAL_SUBTITLE = "Critical Budget Exceeded";
    static final String WARNING_SUBTITLE = "Budget Threshold Exceeded";
    static final String CRITICAL_SOUND = "critical-alert.caf";
    static final String DEFAULT_SOUND = "default";
    static final String UNKNOWN_SERVICE = "Unknown";

    private static final DateTimeFormatter PERIOD_FORMAT = DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US);
    private static final DateTimeFormatter GENERATED_AT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.US).withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();
    private final Clock clock;

    public String formatSubject(AlertContext context) {
        return "AWS Spend Alert: $" + money(context.exceedAmount()) + " over budget";
    }

    public String formatMessage(CostAnalysis analysis, AlertContext context) {
        var lines = new ArrayList<String>();
        lines.add((context.alertLevel() == AlertLevel.CRITICAL ? "🚨" : "⚠️") + " AWS Spend Alert - " + context.alertLevel());
        lines.add("");
        lines.add("Your AWS spending has exceeded the configured threshold.");
        lines.add("");
        lines.add("Current Spending: $" + money(analysis.totalCost()));
        lines.add("Threshold: $" + money(context.threshold()));
        lines.add("Over Budget: $" + money(context.exceedAmount()) + " (" + percent(context.percentageOver()) + ")");
        lines.add("Projected Monthly: $" + money(analysis.projectedMonthly()));
        lines.add("Period: " + formatPeriod(analysis.period()));
        lines.add("");

        if (!context.topServices().isEmpty()) {
            lines.add("Top Cost-Driving Services:");
            var rank = 1;
            for (ServiceCost service : context.topServices()) {
                lines.add(rank++ + ". " + service.serviceName() + ": $" + money(service.cost())
                        + " (" + percent(service.percentage()) + ")");
            }
            lines.add("");
        }

        context.analysis().ifPresent(ai -> appendAnalysis(lines, ai));

        if (!context.anomalies().isEmpty()) {
            lines.add("Anomalies Detected:");
            context.anomalies().forEach(a -> lines.add("• [" + a.severity() + "] " + a.service() + ": " + a.description()));
            lines.add("");
        }

        lines.add("Recommendations:");
        if (context.recommendations().isEmpty()) {
            lines.add("• Review your AWS resources and usage patterns");
            lines.add("• Consider scaling down or terminating unused resources");
            lines.add("• Check for any unexpected charges or services");
        } else {
            context.recommendations().forEach(r -> lines.add("• " + r.description()
                    + (r.estimatedSavings() == null ? "" : " (est. savings $" + money(r.estimatedSavings()) + "/month)")));
        }
        lines.add("");
        lines.add("Alert generated at: " + GENERATED_AT_FORMAT.format(clock.instant()) + " UTC");
        return String.join("\n", lines);
    }

    public String formatSmsMessage(CostAnalysis analysis, AlertContext context) {
        var top = context.topService()
                .map(s -> " Top service: " + s.serviceName() + " ($" + money(s.cost()) + ").")
                .orElse("");
        return "AWS Spend Alert: $" + money(analysis.totalCost()) + " spent (over $" + money(context.threshold())
                + " threshold by $" + money(context.exceedAmount()) + ")." + top
                + " Projected monthly: $" + money(analysis.projectedMonthly());
    }

    public NotificationPayload formatPushPayload(CostAnalysis analysis, AlertContext context) {
        return formatPush(analysis, context, IdGenerator.alertId(clock.instant())).payload();
    }

    /**
     * Builds and serializes the APNs payload.
     *
     * @throws PayloadTooLargeException when the serialized payload exceeds
     *     {@link NotificationPayload#MAX_SERIALIZED_BYTES}; the payload is never truncated
     */
    public PushMessage formatPush(CostAnalysis analysis, AlertContext context, String alertId) {
        var critical = context.alertLevel() == AlertLevel.CRITICAL;
        var payload = NotificationPayload.builder()
                .aps(NotificationPayload.Aps.builder()
                        .alert(NotificationPayload.ApsAlert.builder()
                                .title(PUSH_TITLE)
                                .body("$" + money(analysis.totalCost()) + " spent - $"
                                        + money(context.exceedAmount()) + " over budget")
                                .subtitle(critical ? CRITICAL_SUBTITLE : WARNING_SUBTITLE)
                                .build())
                        .badge(1)
                        .sound(critical ? CRITICAL_SOUND : DEFAULT_SOUND)
                        .contentAvailable(1)
                        .build())
                .customData(NotificationPayload.CustomData.builder()
                        .spendAmount(analysis.totalCost())
                        .threshold(context.threshold())
                        .exceedAmount(context.exceedAmount())
                        .topService(context.topService().map(ServiceCost::serviceName).orElse(UNKNOWN_SERVICE))
                        .alertId(alertId)
                        .build())
                .build();

        var json = objectMapper.writeValueAsString(payload);
        var size = json.getBytes(StandardCharsets.UTF_8).length;
        if (size > NotificationPayload.MAX_SERIALIZED_BYTES) {
            throw PayloadTooLargeException.of(size, NotificationPayload.MAX_SERIALIZED_BYTES);
        }
        return new PushMessage(payload, json, size);
    }

    private static void appendAnalysis(ArrayList<String> lines, AIAnalysisResult ai) {
        lines.add("AI Analysis (" + (ai.isFallback() ? "basic" : ai.modelUsed()) + ", confidence "
                + Math.round(ai.confidenceScore() * 100) + "%):");
        lines.add(ai.summary());
        ai.keyInsights().forEach(insight -> lines.add("• " + insight));
        lines.add("");
    }

    private static String formatPeriod(BillingPeriod period) {
        return PERIOD_FORMAT.format(period.start()) + " - " + PERIOD_FORMAT.format(period.end());
    }

    private static String money(BigDecimal amount) {
        return amount == null ? "0.00" : amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String percent(BigDecimal value) {
        return value.setScale(1, RoundingMode.HALF_UP).toPlainString() + "%";
    }
}
