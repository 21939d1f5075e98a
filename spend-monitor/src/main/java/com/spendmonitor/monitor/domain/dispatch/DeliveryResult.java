package com.spendmonitor.monitor.domain.dispatch;

import com.spendmonitor.monitor.domain.exceptions.ErrorKind;
import com.spendmonitor.monitor.domain.exceptions.SpendMonitorException;

/**
 * Outcome of delivering one alert over one channel to one target.
 */
public record DeliveryResult(
        DeliveryChannel channel,
        String target,
        boolean success,
        ErrorKind errorKind,
        String error,
        int attempts) {

    public static DeliveryResult delivered(DeliveryChannel channel, String target, int attempts) {
        return new DeliveryResult(channel, target, true, null, null, attempts);
    }

    public static DeliveryResult failed(
            DeliveryChannel channel, String target, SpendMonitorException error, int attempts) {
        return new DeliveryResult(channel, target, false, error.kind(), error.getMessage(), attempts);
    }
}
