package com.spendmonitor.monitor.application.controller.device;

import java.util.List;

/**
 * Endpoints to check. When empty, every stored registration is checked.
 */
public record CleanupRequest(List<String> platformEndpointArns) {}
