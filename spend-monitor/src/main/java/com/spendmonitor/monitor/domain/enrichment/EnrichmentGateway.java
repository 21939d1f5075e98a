package com.spendmonitor.monitor.domain.enrichment;

import com.spendmonitor.monitor.domain.cost.CostAnalysis;
import com.spendmonitor.monitor.domain.exceptions.EnrichmentUnavailableException;
import com.spendmonitor.monitor.domain.exceptions.ErrorKind;
import com.spendmonitor.monitor.domain.exceptions.RateLimitExceededException;
import com.spendmonitor.monitor.domain.exceptions.SpendMonitorException;
import com.spendmonitor.monitor.domain.resilience.ExecutionContext;
import com.spendmonitor.monitor.domain.resilience.RateLimiter;
import com.spendmonitor.monitor.domain.resilience.RetryPolicy;
import java.time.Clock;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Single entry point to the inference backend.
 *
 * <p>Each call passes the gates in a fixed order: enabled flag, cost breaker, rate
 * limiter, then the retried backend call. A closed gate yields the deterministic
 * fallback. A backend failure yields the fallback only when {@code fallbackOnError} is
 * set; otherwise it surfaces as {@link EnrichmentUnavailableException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnrichmentGateway {

    private final InferenceBackend backend;
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;
    private final CostCircuitBreaker breaker;
    private final PromptBuilder prompts;
    private final ResponseParser parser;
    private final FallbackAnalyzer fallback;
    private final AnomalyScorer anomalyScorer;
    private final RecommendationRanker recommendationRanker;
    private final EnrichmentSettings settings;
    private final Clock clock;

    public AIAnalysisResult analyze(CostAnalysis analysis, ExecutionContext ctx) {
        return guarded("cost analysis", ctx,
                () -> prompts.analysisPrompt(analysis),
                response -> parser.parseAnalysis(response, clock.instant()),
                reason -> fallback.analysis(analysis, reason, clock.instant()));
    }

    public AnomalyResult detectAnomalies(CostAnalysis current, List<CostAnalysis> history, ExecutionContext ctx) {
        return guarded("anomaly detection", ctx,
                () -> prompts.anomalyPrompt(current, history),
                response -> {
                    var scored = anomalyScorer.score(
                            parser.parseAnomalies(response.text()), current, history, settings.minAnomalyConfidence());
                    return AnomalyResult.of(
                            scored.stream().limit(settings.maxAnomalies()).toList(), response.modelId());
                },
                reason -> fallback.anomalies(current, history, settings.maxAnomalies()));
    }

    public List<Recommendation> recommend(CostAnalysis analysis, ExecutionContext ctx) {
        return guarded("optimization recommendations", ctx,
                () -> prompts.recommendationPrompt(analysis),
                response -> recommendationRanker.rank(
                        parser.parseRecommendations(response.text()), analysis, settings.maxRecommendations()),
                reason -> recommendationRanker.rank(
                        fallback.recommendations(analysis), analysis, settings.maxRecommendations()));
    }

    /**
     * @return true when the configured model answers a probe call
     */
    public boolean validateModelAccess() {
        try {
            backend.probe();
            log.info("Model access validated: model={}", backend.modelId());
            return true;
        } catch (SpendMonitorException e) {
            log.warn("Model access check failed: model={} kind={} error={}",
                    backend.modelId(), e.kind(), e.getMessage());
            return false;
        }
    }

    private <T> T guarded(
            String operation,
            ExecutionContext ctx,
            Supplier<String> prompt,
            Function<InferenceResponse, T> parse,
            Function<FallbackReason, T> fallbackFor) {
        if (!settings.enabled()) {
            log.debug("Enrichment disabled, using fallback for {}", operation);
            return fallbackFor.apply(FallbackReason.DISABLED);
        }
        CircuitBreakerState state;
        try {
            state = breaker.state();
        } catch (SpendMonitorException e) {
            log.warn("Enrichment spend ledger unreadable, using fallback for {}: {}", operation, e.getMessage());
            return fallbackFor.apply(FallbackReason.COST_LEDGER_UNAVAILABLE);
        }
        if (state.open()) {
            log.warn("Enrichment cost breaker open, using fallback for {}: period={} spend={} cap={}",
                    operation, state.periodKey(), state.cumulativeCost(), state.monthlyCap());
            return fallbackFor.apply(FallbackReason.COST_CAP_REACHED);
        }
        try {
            rateLimiter.acquire(ctx);
        } catch (RateLimitExceededException e) {
            log.warn("Enrichment rate limited, using fallback for {}: {}", operation, e.getMessage());
            return fallbackFor.apply(FallbackReason.RATE_LIMITED);
        }

        var request = new InferenceRequest(prompt.get(), settings.maxTokens(), settings.temperature(), settings.topP());
        var result = retryPolicy.execute(operation, () -> backend.invoke(request), ctx);
        if (result.isSuccess()) {
            var response = result.value();
            try {
                breaker.recordCost(response.cost());
            } catch (SpendMonitorException e) {
                log.error("Could not record enrichment cost {} for {}: {}", response.cost(), operation, e.getMessage());
            }
            log.info("{} completed: model={} attempts={} cost={}",
                    operation, response.modelId(), result.attempts(), response.cost());
            try {
                return parse.apply(response);
            } catch (SpendMonitorException e) {
                return onFailure(operation, e, fallbackFor, FallbackReason.UNPARSEABLE_RESPONSE);
            }
        }
        return onFailure(operation, result.error(), fallbackFor, FallbackReason.BACKEND_ERROR);
    }

    private <T> T onFailure(
            String operation,
            SpendMonitorException error,
            Function<FallbackReason, T> fallbackFor,
            FallbackReason reason) {
        if (error.kind() == ErrorKind.CANCELLED) {
            throw error;
        }
        if (settings.fallbackOnError()) {
            log.warn("{} failed ({}), using fallback: {}", operation, error.kind(), error.getMessage());
            return fallbackFor.apply(reason);
        }
        log.error("{} failed ({}): {}", operation, error.kind(), error.getMessage());
        throw EnrichmentUnavailableException.of(operation, error);
    }
}
