package com.spendmonitor.monitor.domain.device;

import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record DeviceRegistration(
        String deviceToken,
        String platformEndpointRef,
        String ownerId,
        Instant registrationDate,
        Instant lastUpdated,
        boolean active) {}
