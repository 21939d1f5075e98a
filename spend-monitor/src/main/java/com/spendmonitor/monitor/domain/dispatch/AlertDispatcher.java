package com.spendmonitor.monitor.domain.dispatch;

import com.spendmonitor.common.event.SpendAlertBroadcast;
import com.spendmonitor.common.id.IdGenerator;
import com.spendmonitor.monitor.domain.cost.CostAnalysis;
import com.spendmonitor.monitor.domain.device.DeviceRegistration;
import com.spendmonitor.monitor.domain.device.DeviceRegistry;
import com.spendmonitor.monitor.domain.device.DeviceTokens;
import com.spendmonitor.monitor.domain.device.PushBackend;
import com.spendmonitor.monitor.domain.evaluation.AlertContext;
import com.spendmonitor.monitor.domain.exceptions.EndpointDisabledException;
import com.spendmonitor.monitor.domain.exceptions.OperationCancelledException;
import com.spendmonitor.monitor.domain.exceptions.PayloadTooLargeException;
import com.spendmonitor.monitor.domain.resilience.ExecutionContext;
import com.spendmonitor.monitor.domain.resilience.RetryPolicy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Fans an alert out over the broadcast channel and every active device.
 *
 * <p>The broadcast is always attempted and runs concurrently with the device pushes; at
 * most {@code deviceParallelism} pushes are in flight at once. Every send goes through
 * the retry policy and a failure on one target never affects another. Failed pushes are
 * reported, not replaced by another channel.
 */
@Slf4j
@Component
public class AlertDispatcher {

    private final BroadcastPublisher broadcastPublisher;
    private final PushBackend pushBackend;
    private final DeviceRegistry deviceRegistry;
    private final AlertMessageFormatter formatter;
    private final RetryPolicy retryPolicy;
    private final Executor executor;
    private final DispatchSettings settings;

    public AlertDispatcher(
            BroadcastPublisher broadcastPublisher,
            PushBackend pushBackend,
            DeviceRegistry deviceRegistry,
            AlertMessageFormatter formatter,
            RetryPolicy retryPolicy,
            @Qualifier("dispatchExecutor") Executor executor,
            DispatchSettings settings) {
        this.broadcastPublisher = broadcastPublisher;
        this.pushBackend = pushBackend;
        this.deviceRegistry = deviceRegistry;
        this.formatter = formatter;
        this.retryPolicy = retryPolicy;
        this.executor = executor;
        this.settings = settings;
    }

    public String formatMessage(CostAnalysis analysis, AlertContext context) {
        return formatter.formatMessage(analysis, context);
    }

    public PushMessage formatPushPayload(CostAnalysis analysis, AlertContext context, String alertId) {
        return formatter.formatPush(analysis, context, alertId);
    }

    public DispatchReport dispatch(
            CostAnalysis analysis, AlertContext context, List<DeviceRegistration> devices, ExecutionContext ctx) {
        return dispatch(analysis, context, settings.broadcastTopic(), devices, ctx);
    }

    public DispatchReport dispatch(
            CostAnalysis analysis,
            AlertContext context,
            String broadcastTopic,
            List<DeviceRegistration> devices,
            ExecutionContext ctx) {
        var alertId = IdGenerator.alertId(ctx.clock().instant());
        var broadcastMessage = SpendAlertBroadcast.builder()
                .alertId(alertId)
                .alertLevel(context.alertLevel())
                .subject(formatter.formatSubject(context))
                .message(formatter.formatMessage(analysis, context))
                .smsMessage(formatter.formatSmsMessage(analysis, context))
                .totalCost(analysis.totalCost())
                .threshold(context.threshold())
                .exceedAmount(context.exceedAmount())
                .publishedAt(ctx.clock().instant())
                .build();

        var broadcastFuture = CompletableFuture.supplyAsync(
                () -> sendBroadcast(broadcastTopic, broadcastMessage, ctx), executor);

        var targets = devices.stream().filter(DeviceRegistration::active).toList();
        List<DeliveryResult> pushes;
        try {
            var push = formatter.formatPush(analysis, context, alertId);
            pushes = pushAll(targets, push, ctx);
        } catch (PayloadTooLargeException e) {
            log.error("Push payload rejected for alert {}: {}", alertId, e.getMessage());
            pushes = targets.stream()
                    .map(d -> DeliveryResult.failed(DeliveryChannel.PUSH, d.platformEndpointRef(), e, 0))
                    .toList();
        }

        var report = DispatchReport.of(alertId, broadcastFuture.join(), pushes, settings.successPolicy());
        log.info("Alert {} dispatched: success={} broadcast={} pushDelivered={}/{} policy={}",
                alertId, report.success(), report.broadcast().success(),
                report.deliveredPushCount(), pushes.size(), report.policy());
        return report;
    }

    private DeliveryResult sendBroadcast(String topic, SpendAlertBroadcast message, ExecutionContext ctx) {
        var result = retryPolicy.execute("broadcast publish", () -> {
            broadcastPublisher.publish(topic, message);
            return topic;
        }, ctx);
        if (result.isSuccess()) {
            return DeliveryResult.delivered(DeliveryChannel.BROADCAST, topic, result.attempts());
        }
        log.error("Broadcast to {} failed after {} attempts: {}", topic, result.attempts(), result.error().getMessage());
        return DeliveryResult.failed(DeliveryChannel.BROADCAST, topic, result.error(), result.attempts());
    }

    private List<DeliveryResult> pushAll(List<DeviceRegistration> targets, PushMessage push, ExecutionContext ctx) {
        var permits = new Semaphore(Math.max(1, settings.deviceParallelism()));
        var futures = new ArrayList<CompletableFuture<DeliveryResult>>(targets.size());
        for (var device : targets) {
            if (!acquire(permits, ctx)) {
                futures.add(CompletableFuture.completedFuture(DeliveryResult.failed(DeliveryChannel.PUSH,
                        device.platformEndpointRef(), OperationCancelledException.of("device push"), 0)));
                continue;
            }
            futures.add(CompletableFuture
                    .supplyAsync(() -> sendPush(device, push, ctx), executor)
                    .whenComplete((result, error) -> permits.release()));
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private DeliveryResult sendPush(DeviceRegistration device, PushMessage push, ExecutionContext ctx) {
        var endpointRef = device.platformEndpointRef();
        var result = retryPolicy.execute("device push", () -> {
            pushBackend.publishToEndpoint(endpointRef, push.json());
            return endpointRef;
        }, ctx);
        if (result.isSuccess()) {
            log.debug("Push delivered: endpoint={} attempts={}", endpointRef, result.attempts());
            return DeliveryResult.delivered(DeliveryChannel.PUSH, endpointRef, result.attempts());
        }
        if (result.error() instanceof EndpointDisabledException) {
            deactivate(endpointRef);
        }
        log.warn("Push to endpoint {} (token {}) failed: kind={} attempts={} error={}",
                endpointRef, DeviceTokens.preview(device.deviceToken()),
                result.errorKind(), result.attempts(), result.error().getMessage());
        return DeliveryResult.failed(DeliveryChannel.PUSH, endpointRef, result.error(), result.attempts());
    }

    private void deactivate(String endpointRef) {
        try {
            deviceRegistry.markInactive(endpointRef);
        } catch (RuntimeException e) {
            log.warn("Could not mark endpoint {} inactive: {}", endpointRef, e.getMessage());
        }
    }

    private static boolean acquire(Semaphore permits, ExecutionContext ctx) {
        if (ctx.isCancelled()) {
            return false;
        }
        try {
            permits.acquire();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.cancel();
            return false;
        }
    }
}
