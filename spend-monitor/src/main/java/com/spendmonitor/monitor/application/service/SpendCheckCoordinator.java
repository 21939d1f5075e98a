package com.spendmonitor.monitor.application.service;

import com.spendmonitor.common.event.SpendCheckRequest;
import com.spendmonitor.common.id.IdGenerator;
import com.spendmonitor.monitor.application.config.SpendMonitorProperties;
import com.spendmonitor.monitor.domain.enrichment.AIAnalysisResult;
import com.spendmonitor.monitor.domain.pipeline.PipelineRunResult;
import com.spendmonitor.monitor.domain.pipeline.RunStatus;
import com.spendmonitor.monitor.domain.pipeline.SpendMonitorPipeline;
import com.spendmonitor.monitor.domain.resilience.ExecutionContext;
import io.micrometer.core.instrument.Counter;
import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs spend checks with the configured time budget and keeps in-flight runs
 * addressable so they can be cancelled.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpendCheckCoordinator {

    private final SpendMonitorPipeline pipeline;
    private final SpendMonitorProperties properties;
    private final Clock clock;
    private final Counter spendChecksCounter;
    private final Counter spendCheckFailuresCounter;
    private final Counter alertsDispatchedCounter;
    private final Counter deliveryFailuresCounter;
    private final Counter enrichmentFallbacksCounter;

    private final Map<String, ExecutionContext> inFlight = new ConcurrentHashMap<>();

    public PipelineRunResult runCheck(SpendCheckRequest request) {
        var normalized = request.requestId() == null
                ? request.toBuilder().requestId(IdGenerator.runId(clock.instant())).build()
                : request;
        var ctx = ExecutionContext.withTimeout(clock, properties.check().runTimeout());
        if (inFlight.putIfAbsent(normalized.requestId(), ctx) != null) {
            log.warn("Spend check {} already running, ignoring duplicate request", normalized.requestId());
            return PipelineRunResult.builder()
                    .status(RunStatus.FAILED)
                    .startedAt(clock.instant())
                    .finishedAt(clock.instant())
                    .error("Spend check " + normalized.requestId() + " is already running")
                    .build();
        }
        try {
            var result = pipeline.run(normalized, ctx);
            record(result);
            return result;
        } finally {
            inFlight.remove(normalized.requestId());
        }
    }

    public boolean cancel(String requestId) {
        var ctx = inFlight.get(requestId);
        if (ctx == null) {
            return false;
        }
        ctx.cancel();
        log.info("Spend check {} cancelled", requestId);
        return true;
    }

    public Set<String> inFlightRequests() {
        return Set.copyOf(inFlight.keySet());
    }

    private void record(PipelineRunResult result) {
        spendChecksCounter.increment();
        if (result.status() == RunStatus.FAILED || result.status() == RunStatus.CANCELLED) {
            spendCheckFailuresCounter.increment();
        }
        if (AIAnalysisResult.FALLBACK_MODEL.equals(result.enrichmentModel())) {
            enrichmentFallbacksCounter.increment();
        }
        var report = result.dispatchReport();
        if (report == null) {
            return;
        }
        if (report.success()) {
            alertsDispatchedCounter.increment();
        }
        deliveryFailuresCounter.increment(report.failedCount());
    }
}
