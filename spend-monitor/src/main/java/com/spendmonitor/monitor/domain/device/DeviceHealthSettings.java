package com.spendmonitor.monitor.domain.device;

import lombok.Builder;

@Builder(toBuilder = true)
public record DeviceHealthSettings(
        int certificateWarningDays,
        int certificateUrgentDays,
        double invalidEndpointWarningRatio,
        double invalidEndpointCriticalRatio) {

    public static DeviceHealthSettings defaults() {
        return new DeviceHealthSettings(30, 7, 0.2, 0.5);
    }
}
