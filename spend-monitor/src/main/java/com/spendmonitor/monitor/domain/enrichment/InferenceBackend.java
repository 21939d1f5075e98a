package com.spendmonitor.monitor.domain.enrichment;

public interface InferenceBackend {

    /**
     * Runs one prompt. Throttling and 5xx responses surface as
     * {@code RateLimitExceededException} / {@code TransientBackendException}; anything
     * else the caller cannot fix by retrying as {@code BackendRejectedException}.
     */
    InferenceResponse invoke(InferenceRequest request);

    /**
     * Cheap call proving the configured model is reachable with current credentials.
     */
    void probe();

    String modelId();
}
