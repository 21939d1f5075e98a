package com.spendmonitor.monitor.application.config;

import com.spendmonitor.monitor.domain.dispatch.DeliverySuccessPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "spend-monitor")
public record SpendMonitorProperties(
        @NotNull @Valid Check check,
        @NotNull @Valid Retry retry,
        @NotNull @Valid Enrichment enrichment,
        @NotNull @Valid Dispatch dispatch,
        @NotNull @Valid Devices devices,
        @NotNull @Valid Aws aws) {

    public record Check(
            @NotNull @DecimalMin(value = "0", inclusive = false) BigDecimal threshold,
            @NotNull @PositiveOrZero BigDecimal minServiceCost,
            @Min(1) int topServices,
            @NotNull Duration runTimeout) {}

    public record Retry(
            @Min(1) int maxAttempts,
            @NotNull Duration baseDelay,
            @NotNull Duration maxDelay,
            @DecimalMin("1.0") double multiplier,
            @DecimalMin("0.0") @DecimalMax(value = "1.0", inclusive = false) double jitterRatio) {}

    public record Enrichment(
            boolean enabled,
            boolean fallbackOnError,
            boolean detectAnomalies,
            boolean recommendOptimizations,
            @NotBlank String modelId,
            @Min(1) int maxTokens,
            @DecimalMin("0.0") @DecimalMax("1.0") double temperature,
            @DecimalMin("0.0") @DecimalMax("1.0") double topP,
            @Min(1) int maxCallsPerMinute,
            @NotNull @PositiveOrZero BigDecimal monthlyCostCap,
            @NotNull @DecimalMin("0.0") @DecimalMax("1.0") BigDecimal costWarningRatio,
            @NotNull @PositiveOrZero BigDecimal inputTokenPricePer1k,
            @NotNull @PositiveOrZero BigDecimal outputTokenPricePer1k,
            @DecimalMin("0.0") @DecimalMax("1.0") double minAnomalyConfidence,
            @Min(1) int maxAnomalies,
            @Min(1) int maxRecommendations,
            @Min(1) int historyMonths) {}

    public record Dispatch(
            @NotBlank String broadcastTopic,
            boolean pushEnabled,
            @Min(1) int deviceParallelism,
            @NotNull DeliverySuccessPolicy successPolicy,
            @NotNull Duration sendTimeout) {}

    public record Devices(
            @NotBlank String platformApplicationArn,
            @NotBlank String keyPrefix,
            @Min(1) int registrationsPerMinute,
            @Min(1) int certificateWarningDays,
            @Min(1) int certificateUrgentDays,
            @DecimalMin("0.0") @DecimalMax("1.0") double invalidEndpointWarningRatio,
            @DecimalMin("0.0") @DecimalMax("1.0") double invalidEndpointCriticalRatio) {}

    public record Aws(@NotBlank String region) {}
}
