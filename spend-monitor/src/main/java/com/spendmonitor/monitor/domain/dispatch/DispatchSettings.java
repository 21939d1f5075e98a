package com.spendmonitor.monitor.domain.dispatch;

import lombok.Builder;

@Builder(toBuilder = true)
public record DispatchSettings(
        String broadcastTopic,
        boolean pushEnabled,
        int deviceParallelism,
        DeliverySuccessPolicy successPolicy) {}
