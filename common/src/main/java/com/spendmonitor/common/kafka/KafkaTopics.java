package com.spendmonitor.common.kafka;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class KafkaTopics {

    public static final String SPEND_ALERTS = "spend-alerts";
    public static final String SPEND_CHECK_REQUESTS = "spend-check-requests";
}
