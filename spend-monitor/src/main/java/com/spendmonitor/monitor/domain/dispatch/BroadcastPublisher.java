package com.spendmonitor.monitor.domain.dispatch;

import com.spendmonitor.common.event.SpendAlertBroadcast;

public interface BroadcastPublisher {

    /**
     * Publishes to every subscriber of the topic. Returns once the channel has accepted
     * the message.
     */
    void publish(String topic, SpendAlertBroadcast message);
}
