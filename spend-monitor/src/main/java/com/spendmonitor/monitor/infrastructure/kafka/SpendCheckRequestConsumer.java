package com.spendmonitor.monitor.infrastructure.kafka;

import com.spendmonitor.common.event.SpendCheckRequest;
import com.spendmonitor.common.kafka.KafkaTopics;
import com.spendmonitor.monitor.application.service.SpendCheckCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class SpendCheckRequestConsumer {

    private final SpendCheckCoordinator coordinator;

    @KafkaListener(
            topics = KafkaTopics.SPEND_CHECK_REQUESTS,
            groupId = "spend-monitor-checks",
            containerFactory = "spendCheckRequestListenerContainerFactory")
    public void onSpendCheckRequest(SpendCheckRequest request) {
        var result = coordinator.runCheck(request);
        log.info("Spend check {} finished with status {} (total: {}, threshold: {})",
                result.runId(), result.status(), result.totalCost(), result.threshold());
    }
}
