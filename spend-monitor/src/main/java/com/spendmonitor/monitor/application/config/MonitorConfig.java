package com.spendmonitor.monitor.application.config;

import com.spendmonitor.monitor.domain.device.DeviceHealthSettings;
import com.spendmonitor.monitor.domain.dispatch.DispatchSettings;
import com.spendmonitor.monitor.domain.enrichment.CostCircuitBreaker;
import com.spendmonitor.monitor.domain.enrichment.EnrichmentSettings;
import com.spendmonitor.monitor.domain.enrichment.SpendLedger;
import com.spendmonitor.monitor.domain.pipeline.PipelineSettings;
import com.spendmonitor.monitor.domain.resilience.RateLimiter;
import com.spendmonitor.monitor.domain.resilience.RetryPolicy;
import com.spendmonitor.monitor.domain.resilience.RetrySettings;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Translates {@link SpendMonitorProperties} into the plain settings records and
 * stateful components the domain is built from.
 */
@Configuration
@EnableConfigurationProperties(SpendMonitorProperties.class)
public class MonitorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy retryPolicy(SpendMonitorProperties properties) {
        var retry = properties.retry();
        return new RetryPolicy(RetrySettings.builder()
                .maxAttempts(retry.maxAttempts())
                .baseDelay(retry.baseDelay())
                .maxDelay(retry.maxDelay())
                .multiplier(retry.multiplier())
                .jitterRatio(retry.jitterRatio())
                .build());
    }

    @Bean
    public RateLimiter enrichmentRateLimiter(SpendMonitorProperties properties, Clock clock) {
        return new RateLimiter(properties.enrichment().maxCallsPerMinute(), Duration.ofMinutes(1), clock);
    }

    @Bean
    public CostCircuitBreaker costCircuitBreaker(SpendMonitorProperties properties, SpendLedger ledger, Clock clock) {
        var enrichment = properties.enrichment();
        return new CostCircuitBreaker(ledger, enrichment.monthlyCostCap(), enrichment.costWarningRatio(), clock);
    }

    @Bean
    public EnrichmentSettings enrichmentSettings(SpendMonitorProperties properties) {
        var enrichment = properties.enrichment();
        return EnrichmentSettings.builder()
                .enabled(enrichment.enabled())
                .fallbackOnError(enrichment.fallbackOnError())
                .detectAnomalies(enrichment.detectAnomalies())
                .recommendOptimizations(enrichment.recommendOptimizations())
                .maxTokens(enrichment.maxTokens())
                .temperature(enrichment.temperature())
                .topP(enrichment.topP())
                .minAnomalyConfidence(enrichment.minAnomalyConfidence())
                .maxAnomalies(enrichment.maxAnomalies())
                .maxRecommendations(enrichment.maxRecommendations())
                .historyMonths(enrichment.historyMonths())
                .build();
    }

    @Bean
    public DispatchSettings dispatchSettings(SpendMonitorProperties properties) {
        var dispatch = properties.dispatch();
        return DispatchSettings.builder()
                .broadcastTopic(dispatch.broadcastTopic())
                .pushEnabled(dispatch.pushEnabled())
                .deviceParallelism(dispatch.deviceParallelism())
                .successPolicy(dispatch.successPolicy())
                .build();
    }

    @Bean
    public PipelineSettings pipelineSettings(SpendMonitorProperties properties) {
        var check = properties.check();
        return PipelineSettings.builder()
                .threshold(check.threshold())
                .minServiceCost(check.minServiceCost())
                .topServices(check.topServices())
                .build();
    }

    @Bean
    public DeviceHealthSettings deviceHealthSettings(SpendMonitorProperties properties) {
        var devices = properties.devices();
        return DeviceHealthSettings.builder()
                .certificateWarningDays(devices.certificateWarningDays())
                .certificateUrgentDays(devices.certificateUrgentDays())
                .invalidEndpointWarningRatio(devices.invalidEndpointWarningRatio())
                .invalidEndpointCriticalRatio(devices.invalidEndpointCriticalRatio())
                .build();
    }
}
