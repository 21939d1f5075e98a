package com.spendmonitor.monitor.domain.pipeline;

import com.spendmonitor.common.event.SpendCheckRequest;
import com.spendmonitor.common.id.IdGenerator;
import com.spendmonitor.monitor.domain.cost.BillingPeriod;
import com.spendmonitor.monitor.domain.cost.CostAnalysis;
import com.spendmonitor.monitor.domain.cost.CostDataProvider;
import com.spendmonitor.monitor.domain.device.DeviceRegistration;
import com.spendmonitor.monitor.domain.device.DeviceRegistry;
import com.spendmonitor.monitor.domain.dispatch.AlertDispatcher;
import com.spendmonitor.monitor.domain.dispatch.DispatchSettings;
import com.spendmonitor.monitor.domain.enrichment.Anomaly;
import com.spendmonitor.monitor.domain.enrichment.EnrichmentGateway;
import com.spendmonitor.monitor.domain.enrichment.EnrichmentSettings;
import com.spendmonitor.monitor.domain.enrichment.Recommendation;
import com.spendmonitor.monitor.domain.evaluation.AlertContext;
import com.spendmonitor.monitor.domain.evaluation.ThresholdEvaluator;
import com.spendmonitor.monitor.domain.exceptions.EnrichmentUnavailableException;
import com.spendmonitor.monitor.domain.exceptions.ErrorKind;
import com.spendmonitor.monitor.domain.exceptions.SpendMonitorException;
import com.spendmonitor.monitor.domain.resilience.ExecutionContext;
import com.spendmonitor.monitor.domain.resilience.RetryPolicy;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * One spend check: pull costs, evaluate, enrich, resolve devices, dispatch. Expected
 * failures end the run with a FAILED or CANCELLED result instead of an exception.
 * Enrichment and device resolution degrade: the alert still goes out without them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpendMonitorPipeline {

    private final CostDataProvider costDataProvider;
    private final ThresholdEvaluator evaluator;
    private final EnrichmentGateway enrichmentGateway;
    private final DeviceRegistry deviceRegistry;
    private final AlertDispatcher dispatcher;
    private final RetryPolicy retryPolicy;
    private final PipelineSettings settings;
    private final EnrichmentSettings enrichmentSettings;
    private final DispatchSettings dispatchSettings;
    private final Clock clock;

    public PipelineRunResult run(SpendCheckRequest request, ExecutionContext ctx) {
        var startedAt = clock.instant();
        var threshold = request.threshold() != null ? request.threshold() : settings.threshold();
        var result = PipelineRunResult.builder()
                .runId(IdGenerator.runId(startedAt))
                .startedAt(startedAt)
                .threshold(threshold);
        log.info("Spend check started: runId={} requestId={} threshold={}",
                result.build().runId(), request.requestId(), threshold);

        try {
            ctx.throwIfCancelled("spend check");
            var period = request.hasPeriod()
                    ? new BillingPeriod(request.periodStart(), request.periodEnd())
                    : BillingPeriod.monthToDate(LocalDate.ofInstant(startedAt, ZoneOffset.UTC));
            var costs = retryPolicy.execute("cost retrieval", () -> costDataProvider.getCosts(period), ctx)
                    .getOrThrow();
            result.totalCost(costs.totalCost());

            var evaluation = evaluator.evaluate(costs, threshold, settings.minServiceCost(), settings.topServices());
            if (evaluation.isEmpty()) {
                return finish(result.status(RunStatus.NO_ALERT));
            }

            var context = enrich(costs, evaluation.get(), ctx);
            result.alertLevel(context.alertLevel())
                    .enrichmentModel(context.analysis().map(a -> a.modelUsed()).orElse(null));

            var devices = resolveDevices();
            ctx.throwIfCancelled("alert dispatch");
            var report = dispatcher.dispatch(costs, context, devices, ctx);
            return finish(result.status(RunStatus.COMPLETED).dispatchReport(report));
        } catch (SpendMonitorException e) {
            var status = e.kind() == ErrorKind.CANCELLED ? RunStatus.CANCELLED : RunStatus.FAILED;
            log.error("Spend check {}: kind={} error={}", status, e.kind(), e.getMessage());
            return finish(result.status(status).errorKind(e.kind()).error(e.getMessage()));
        }
    }

    private AlertContext enrich(CostAnalysis costs, AlertContext context, ExecutionContext ctx) {
        var enriched = context;
        try {
            enriched = enriched.withAnalysis(enrichmentGateway.analyze(costs, ctx));

            List<Anomaly> anomalies = List.of();
            if (enrichmentSettings.detectAnomalies()) {
                anomalies = enrichmentGateway.detectAnomalies(costs, history(costs, ctx), ctx).anomalies();
            }
            List<Recommendation> recommendations = List.of();
            if (enrichmentSettings.recommendOptimizations()) {
                recommendations = enrichmentGateway.recommend(costs, ctx);
            }
            return enriched.withInsights(anomalies, recommendations);
        } catch (EnrichmentUnavailableException e) {
            log.warn("Continuing without AI enrichment: {}", e.getMessage());
            return enriched;
        } catch (SpendMonitorException e) {
            if (e.kind() == ErrorKind.CANCELLED) {
                throw e;
            }
            log.warn("Enrichment failed ({}), continuing without it: {}", e.kind(), e.getMessage());
            return enriched;
        }
    }

    private List<CostAnalysis> history(CostAnalysis costs, ExecutionContext ctx) {
        var result = retryPolicy.execute("historical cost retrieval",
                () -> costDataProvider.getHistoricalCosts(costs.period(), enrichmentSettings.historyMonths()), ctx);
        if (result.isSuccess()) {
            return result.value();
        }
        if (result.errorKind() == ErrorKind.CANCELLED) {
            throw result.error();
        }
        log.warn("Historical costs unavailable, detecting anomalies without baseline: {}", result.error().getMessage());
        return List.of();
    }

    private List<DeviceRegistration> resolveDevices() {
        if (!dispatchSettings.pushEnabled()) {
            return List.of();
        }
        try {
            return deviceRegistry.activeRegistrations();
        } catch (RuntimeException e) {
            log.warn("Device registry unavailable, sending broadcast only: {}", e.getMessage());
            return List.of();
        }
    }

    private PipelineRunResult finish(PipelineRunResult.PipelineRunResultBuilder result) {
        var finished = result.finishedAt(clock.instant()).build();
        log.info("Spend check finished: runId={} status={} totalCost={} level={}",
                finished.runId(), finished.status(), finished.totalCost(), finished.alertLevel());
        return finished;
    }
}
