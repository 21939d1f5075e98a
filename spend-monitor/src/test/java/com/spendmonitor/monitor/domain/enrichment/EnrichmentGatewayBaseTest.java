package com.spendmonitor.monitor.domain.enrichment;

import static com.spendmonitor.monitor.test.fixtures.CostFixtures.SOME_INSTANT;

import com.spendmonitor.monitor.domain.resilience.ExecutionContext;
import com.spendmonitor.monitor.domain.resilience.RateLimiter;
import com.spendmonitor.monitor.domain.resilience.RetryPolicy;
import com.spendmonitor.monitor.domain.resilience.RetrySettings;
import com.spendmonitor.monitor.test.fixtures.InMemorySpendLedger;
import com.spendmonitor.monitor.test.fixtures.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public abstract class EnrichmentGatewayBaseTest {

    static final String MODEL = "amazon.titan-text-express-v1";
    static final String ANALYSIS_JSON =
            "{\"summary\": \"EC2 drives spend\", \"keyInsights\": [\"EC2 is 60%\"], \"confidenceScore\": 0.8}";

    static final EnrichmentSettings SETTINGS = EnrichmentSettings.builder()
            .enabled(true)
            .fallbackOnError(true)
            .detectAnomalies(true)
            .recommendOptimizations(true)
            .maxTokens(500)
            .temperature(0.3)
            .topP(0.9)
            .minAnomalyConfidence(0.5)
            .maxAnomalies(5)
            .maxRecommendations(5)
            .historyMonths(3)
            .build();

    static final RetrySettings FAST_RETRY = RetrySettings.builder()
            .maxAttempts(3)
            .baseDelay(Duration.ofMillis(1))
            .maxDelay(Duration.ofMillis(2))
            .multiplier(2.0)
            .jitterRatio(0.0)
            .build();

    @Mock
    InferenceBackend backend;

    MutableClock clock;
    InMemorySpendLedger ledger;
    CostCircuitBreaker breaker;
    RateLimiter rateLimiter;
    ExecutionContext ctx;

    @BeforeEach
    void setUpCollaborators() {
        clock = new MutableClock(SOME_INSTANT);
        ledger = new InMemorySpendLedger();
        breaker = new CostCircuitBreaker(ledger, new BigDecimal("1.00"), new BigDecimal("0.8"), clock);
        rateLimiter = new RateLimiter(10, Duration.ofMinutes(1), clock);
        ctx = ExecutionContext.withTimeout(clock, Duration.ofSeconds(30));
    }

    EnrichmentGateway gateway(EnrichmentSettings settings) {
        return new EnrichmentGateway(
                backend,
                new RetryPolicy(FAST_RETRY),
                rateLimiter,
                breaker,
                new PromptBuilder(),
                new ResponseParser(),
                new FallbackAnalyzer(),
                new AnomalyScorer(),
                new RecommendationRanker(),
                settings,
                clock);
    }

    EnrichmentGateway gateway() {
        return gateway(SETTINGS);
    }

    static InferenceResponse response(String text) {
        return new InferenceResponse(text, 120, 80, new BigDecimal("0.25"), MODEL);
    }
}
