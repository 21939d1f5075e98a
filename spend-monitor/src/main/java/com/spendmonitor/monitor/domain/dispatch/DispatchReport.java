package com.spendmonitor.monitor.domain.dispatch;

import java.util.ArrayList;
import java.util.List;

public record DispatchReport(
        String alertId,
        DeliveryResult broadcast,
        List<DeliveryResult> pushes,
        DeliverySuccessPolicy policy,
        boolean success) {

    public DispatchReport {
        pushes = List.copyOf(pushes);
    }

    public static DispatchReport of(
            String alertId, DeliveryResult broadcast, List<DeliveryResult> pushes, DeliverySuccessPolicy policy) {
        return new DispatchReport(alertId, broadcast, pushes, policy, policy.evaluate(broadcast, pushes));
    }

    public List<DeliveryResult> results() {
        var all = new ArrayList<DeliveryResult>(pushes.size() + 1);
        all.add(broadcast);
        all.addAll(pushes);
        return all;
    }

    public long deliveredPushCount() {
        return pushes.stream().filter(DeliveryResult::success).count();
    }

    public long failedCount() {
        return results().stream().filter(r -> !r.success()).count();
    }
}
