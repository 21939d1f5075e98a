package com.spendmonitor.monitor.domain.device;

public record EndpointAttributes(String endpointRef, String token, boolean enabled) {}
