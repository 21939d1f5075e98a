package com.spendmonitor.monitor.application.config;

import com.spendmonitor.monitor.domain.enrichment.CostCircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter spendChecksCounter(MeterRegistry registry) {
        return Counter.builder("spend.checks")
                .description("Total spend checks run")
                .register(registry);
    }

    @Bean
    public Counter spendCheckFailuresCounter(MeterRegistry registry) {
        return Counter.builder("spend.checks.failed")
                .description("Spend checks that ended FAILED or CANCELLED")
                .register(registry);
    }

    @Bean
    public Counter alertsDispatchedCounter(MeterRegistry registry) {
        return Counter.builder("alerts.dispatched")
                .description("Alerts whose dispatch met the delivery success policy")
                .register(registry);
    }

    @Bean
    public Counter deliveryFailuresCounter(MeterRegistry registry) {
        return Counter.builder("alerts.delivery.failures")
                .description("Failed per-channel deliveries")
                .register(registry);
    }

    @Bean
    public Counter enrichmentFallbacksCounter(MeterRegistry registry) {
        return Counter.builder("enrichment.fallbacks")
                .description("Alerts sent with the deterministic fallback analysis")
                .register(registry);
    }

    @Bean
    public Counter devicesRegisteredCounter(MeterRegistry registry) {
        return Counter.builder("devices.registered")
                .description("Device registrations and re-registrations")
                .register(registry);
    }

    @Bean
    public Counter devicesRemovedCounter(MeterRegistry registry) {
        return Counter.builder("devices.removed")
                .description("Device bindings removed explicitly or by invalid-token cleanup")
                .register(registry);
    }

    @Bean
    public Gauge enrichmentSpendGauge(MeterRegistry registry, CostCircuitBreaker costCircuitBreaker) {
        return Gauge.builder("enrichment.spend.period", costCircuitBreaker,
                        breaker -> breaker.state().cumulativeCost().doubleValue())
                .description("Estimated enrichment spend in the current billing period, USD")
                .register(registry);
    }
}
