package com.spendmonitor.monitor.domain.enrichment;

import com.spendmonitor.monitor.domain.cost.CostAnalysis;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Builds the prompts sent to the inference backend. Every prompt asks for a single JSON
 * object so {@link ResponseParser} can read the answer.
 */
@Component
public class PromptBuilder {

    public String analysisPrompt(CostAnalysis analysis) {
        return """
                You are a cloud cost analyst. Review the spending below and explain what drives it.

                %s

                Respond with only a JSON object of the form:
                {"summary": "<two sentences>", "keyInsights": ["<insight>", "..."], "confidenceScore": <0.0-1.0>}
                Give at most 5 key insights, each under 160 characters.
                """.formatted(describe(analysis));
    }

    public String anomalyPrompt(CostAnalysis current, List<CostAnalysis> history) {
        var baseline = history.isEmpty()
                ? "No historical data is available."
                : history.stream()
                        .map(h -> "- " + h.period().start() + " to " + h.period().end()
                                + ": total $" + money(h.totalCost()) + " " + topServices(h.serviceBreakdown(), 5))
                        .collect(Collectors.joining("\n"));
        return """
                You are a cloud cost analyst looking for unusual spending.

                Current period:
                %s

                Previous periods:
                %s

                Respond with only a JSON object of the form:
                {"anomalies": [{"service": "<name>", "severity": "LOW|MEDIUM|HIGH",
                  "description": "<what changed>", "confidenceScore": <0.0-1.0>,
                  "suggestedAction": "<next step>"}]}
                Return an empty list when nothing is unusual.
                """.formatted(describe(current), baseline);
    }

    public String recommendationPrompt(CostAnalysis analysis) {
        return """
                You are a cloud cost optimization advisor.

                %s

                Respond with only a JSON object of the form:
                {"recommendations": [{"category": "RIGHTSIZING|RESERVED_INSTANCES|SPOT_INSTANCES|STORAGE_OPTIMIZATION|OTHER",
                  "service": "<name>", "description": "<action>", "estimatedSavings": <monthly USD>,
                  "priority": "LOW|MEDIUM|HIGH", "implementationComplexity": "EASY|MEDIUM|COMPLEX"}]}
                Give at most 8 recommendations.
                """.formatted(describe(analysis));
    }

    private static String describe(CostAnalysis analysis) {
        return "Period: " + analysis.period().start() + " to " + analysis.period().end() + "\n"
                + "Total spend: $" + money(analysis.totalCost()) + "\n"
                + "Projected monthly: $" + money(analysis.projectedMonthly()) + "\n"
                + "By service: " + topServices(analysis.serviceBreakdown(), 10);
    }

    private static String topServices(Map<String, BigDecimal> breakdown, int limit) {
        return breakdown.entrySet().stream()
                .sorted(Map.Entry.<String, BigDecimal>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry::getKey))
                .limit(limit)
                .map(e -> e.getKey() + " $" + money(e.getValue()))
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private static String money(BigDecimal amount) {
        return amount == null ? "0.00" : amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
