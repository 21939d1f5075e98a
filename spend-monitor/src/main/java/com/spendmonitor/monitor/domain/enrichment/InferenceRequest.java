package com.spendmonitor.monitor.domain.enrichment;

public record InferenceRequest(String prompt, int maxTokens, double temperature, double topP) {}
