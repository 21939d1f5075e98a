package com.spendmonitor.monitor.domain.dispatch;

public enum DeliveryChannel {
    BROADCAST,
    PUSH
}
