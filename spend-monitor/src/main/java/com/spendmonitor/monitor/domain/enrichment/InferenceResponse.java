package com.spendmonitor.monitor.domain.enrichment;

import java.math.BigDecimal;

/**
 * Raw model output together with the cost the backend attributes to the call.
 */
public record InferenceResponse(String text, int inputTokens, int outputTokens, BigDecimal cost, String modelId) {}
