package com.spendmonitor.monitor.domain.enrichment;

import lombok.Builder;

@Builder(toBuilder = true)
public record EnrichmentSettings(
        boolean enabled,
        boolean fallbackOnError,
        boolean detectAnomalies,
        boolean recommendOptimizations,
        int maxTokens,
        double temperature,
        double topP,
        double minAnomalyConfidence,
        int maxAnomalies,
        int maxRecommendations,
        int historyMonths) {}
