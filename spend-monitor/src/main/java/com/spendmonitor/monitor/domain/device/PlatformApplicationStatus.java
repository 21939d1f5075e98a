package com.spendmonitor.monitor.domain.device;

import java.time.Instant;

/**
 * @param certificateExpiry signing certificate expiry, null when the platform uses token
 *     based authentication
 */
public record PlatformApplicationStatus(String platform, boolean enabled, Instant certificateExpiry) {}
