package com.spendmonitor.monitor.domain.enrichment;

import com.spendmonitor.common.json.JacksonConfig;
import com.spendmonitor.monitor.domain.exceptions.BackendRejectedException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Reads the JSON object embedded in model output. Models often wrap the object in prose
 * or code fences, so everything outside the outermost braces is ignored.
 */
@Slf4j
@Component
public class ResponseParser {

    static final double UNPARSEABLE_CONFIDENCE = 0.1;
    static final double DEFAULT_CONFIDENCE = 0.5;
    private static final int MAX_INSIGHTS = 5;
    private static final int EXCERPT_LENGTH = 200;

    private final ObjectMapper mapper = JacksonConfig.createLenientMapper();

    public AIAnalysisResult parseAnalysis(InferenceResponse response, Instant analysedAt) {
        var builder = AIAnalysisResult.builder()
                .analysisTimestamp(analysedAt)
                .modelUsed(response.modelId())
                .processingCost(response.cost());
        try {
            var json = extractObject(response.text());
            var parsed = mapper.readValue(json, AnalysisJson.class);
            if (parsed.summary() == null || parsed.summary().isBlank()) {
                throw BackendRejectedException.of("analysis parsing", "response has no summary");
            }
            var insights = parsed.keyInsights() == null ? List.<String>of() : parsed.keyInsights().stream()
                    .filter(Objects::nonNull)
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .limit(MAX_INSIGHTS)
                    .toList();
            return builder
                    .summary(parsed.summary().trim())
                    .keyInsights(insights)
                    .confidenceScore(parsed.confidenceScore() == null ? DEFAULT_CONFIDENCE : parsed.confidenceScore())
                    .build();
        } catch (JacksonException | BackendRejectedException e) {
            log.warn("Unstructured analysis response from {}: {}", response.modelId(), e.getMessage());
            return builder
                    .summary("AI analysis returned an unstructured response")
                    .keyInsights(excerpt(response.text()))
                    .confidenceScore(UNPARSEABLE_CONFIDENCE)
                    .fallbackReason(FallbackReason.UNPARSEABLE_RESPONSE)
                    .build();
        }
    }

    public List<Anomaly> parseAnomalies(String text) {
        var parsed = read(text, AnomaliesJson.class, "anomaly parsing");
        if (parsed.anomalies() == null) {
            return List.of();
        }
        var anomalies = new ArrayList<Anomaly>();
        for (var item : parsed.anomalies()) {
            if (item == null || item.service() == null || item.service().isBlank()) {
                continue;
            }
            anomalies.add(Anomaly.builder()
                    .service(item.service().trim())
                    .severity(parseEnum(Severity.class, item.severity(), Severity.MEDIUM))
                    .description(Objects.requireNonNullElse(item.description(), ""))
                    .confidenceScore(item.confidenceScore() == null ? DEFAULT_CONFIDENCE : item.confidenceScore())
                    .suggestedAction(Objects.requireNonNullElse(item.suggestedAction(), ""))
                    .build());
        }
        return anomalies;
    }

    public List<Recommendation> parseRecommendations(String text) {
        var parsed = read(text, RecommendationsJson.class, "recommendation parsing");
        if (parsed.recommendations() == null) {
            return List.of();
        }
        var recommendations = new ArrayList<Recommendation>();
        for (var item : parsed.recommendations()) {
            if (item == null || item.description() == null || item.description().isBlank()) {
                continue;
            }
            recommendations.add(Recommendation.builder()
                    .category(RecommendationCategory.parse(item.category()))
                    .service(Objects.requireNonNullElse(item.service(), "").trim())
                    .description(item.description().trim())
                    .estimatedSavings(item.estimatedSavings())
                    .priority(parseEnum(Priority.class, item.priority(), Priority.MEDIUM))
                    .implementationComplexity(parseEnum(
                            ImplementationComplexity.class, item.implementationComplexity(), ImplementationComplexity.MEDIUM))
                    .build());
        }
        return recommendations;
    }

    private <T> T read(String text, Class<T> type, String operation) {
        try {
            return mapper.readValue(extractObject(text), type);
        } catch (JacksonException e) {
            throw BackendRejectedException.of(operation, e);
        }
    }

    static String extractObject(String text) {
        if (text == null) {
            throw BackendRejectedException.of("response parsing", "empty model response");
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw BackendRejectedException.of("response parsing", "no JSON object in model response");
        }
        return text.substring(start, end + 1);
    }

    private static List<String> excerpt(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        var trimmed = text.trim();
        return List.of(trimmed.length() <= EXCERPT_LENGTH ? trimmed : trimmed.substring(0, EXCERPT_LENGTH) + "...");
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, E defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return defaultValue;
        }
    }

    record AnalysisJson(String summary, List<String> keyInsights, Double confidenceScore) {}

    record AnomaliesJson(List<AnomalyJson> anomalies) {}

    record AnomalyJson(
            String service, String severity, String description, Double confidenceScore, String suggestedAction) {}

    record RecommendationsJson(List<RecommendationJson> recommendations) {}

    record RecommendationJson(
            String category,
            String service,
            String description,
            BigDecimal estimatedSavings,
            String priority,
            String implementationComplexity) {}
}
