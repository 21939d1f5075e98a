package com.spendmonitor.monitor.application.controller.device;

import jakarta.validation.constraints.NotBlank;

public record UpdateDeviceTokenRequest(
        @NotBlank String platformEndpointArn,
        @NotBlank String newDeviceToken) {}
