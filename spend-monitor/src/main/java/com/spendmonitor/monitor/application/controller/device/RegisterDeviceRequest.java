package com.spendmonitor.monitor.application.controller.device;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterDeviceRequest(
        @NotBlank String deviceToken,
        @Size(max = 128) String userId) {}
