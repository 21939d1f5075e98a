package com.spendmonitor.monitor.application.controller.device;

import java.time.Instant;

public record DeviceResponse(
        String deviceToken,
        String platformEndpointArn,
        String userId,
        Instant registrationDate,
        Instant lastUpdated,
        boolean active) {}
