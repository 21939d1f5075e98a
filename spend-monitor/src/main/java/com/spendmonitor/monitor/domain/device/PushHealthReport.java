package com.spendmonitor.monitor.domain.device;

import java.time.Instant;
import java.util.List;
import lombok.Builder;

@Builder(toBuilder = true)
public record PushHealthReport(
        HealthStatus overall,
        Long certificateDaysRemaining,
        int activeEndpointCount,
        int invalidEndpointCount,
        List<String> recommendations,
        Instant checkedAt) {}
