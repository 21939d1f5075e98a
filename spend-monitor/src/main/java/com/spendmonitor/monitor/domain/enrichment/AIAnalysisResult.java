package com.spendmonitor.monitor.domain.enrichment;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;

@Builder(toBuilder = true)
public record AIAnalysisResult(
        String summary,
        List<String> keyInsights,
        double confidenceScore,
        Instant analysisTimestamp,
        String modelUsed,
        BigDecimal processingCost,
        FallbackReason fallbackReason) {

    public static final String FALLBACK_MODEL = "fallback";

    public AIAnalysisResult {
        keyInsights = keyInsights == null ? List.of() : List.copyOf(keyInsights);
        confidenceScore = Math.max(0.0, Math.min(1.0, confidenceScore));
    }

    public boolean isFallback() {
        return FALLBACK_MODEL.equals(modelUsed);
    }
}
