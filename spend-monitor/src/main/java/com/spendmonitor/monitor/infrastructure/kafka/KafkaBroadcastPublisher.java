package com.spendmonitor.monitor.infrastructure.kafka;

import com.spendmonitor.common.event.SpendAlertBroadcast;
import com.spendmonitor.monitor.application.config.SpendMonitorProperties;
import com.spendmonitor.monitor.domain.dispatch.BroadcastPublisher;
import com.spendmonitor.monitor.domain.exceptions.OperationCancelledException;
import com.spendmonitor.monitor.domain.exceptions.TransientBackendException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes alert broadcasts keyed by alert id and waits for the broker acknowledgement,
 * so a failed send surfaces to the dispatcher's retry loop.
 */
@Slf4j
@Component
public class KafkaBroadcastPublisher implements BroadcastPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Duration sendTimeout;

    public KafkaBroadcastPublisher(KafkaTemplate<String, Object> kafkaTemplate, SpendMonitorProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.sendTimeout = properties.dispatch().sendTimeout();
    }

    @Override
    public void publish(String topic, SpendAlertBroadcast message) {
        try {
            var result = kafkaTemplate.send(topic, message.alertId(), message)
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Published alert {} to {} partition {}",
                    message.alertId(), topic, result.getRecordMetadata().partition());
        } catch (ExecutionException e) {
            throw TransientBackendException.of("broadcast", e.getCause() == null ? e : e.getCause());
        } catch (TimeoutException e) {
            throw TransientBackendException.of("broadcast", "no acknowledgement within " + sendTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw OperationCancelledException.of("broadcast");
        }
    }
}
