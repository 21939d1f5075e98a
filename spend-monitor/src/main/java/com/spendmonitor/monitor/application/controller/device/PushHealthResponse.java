package com.spendmonitor.monitor.application.controller.device;

import java.time.Instant;
import java.util.List;

public record PushHealthResponse(
        String overallHealth,
        Long certificateDaysRemaining,
        int activeEndpoints,
        int invalidEndpoints,
        List<String> recommendations,
        Instant checkedAt) {}
