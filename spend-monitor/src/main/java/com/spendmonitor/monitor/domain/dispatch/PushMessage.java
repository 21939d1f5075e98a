package com.spendmonitor.monitor.domain.dispatch;

import com.spendmonitor.common.push.NotificationPayload;

/**
 * A push payload together with its serialized form, already checked against the size
 * limit.
 */
public record PushMessage(NotificationPayload payload, String json, int sizeBytes) {}
