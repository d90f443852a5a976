package com.payment.threatintel.messaging;

import com.payment.threatintel.alerting.ThreatAlert;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes threat alerts, keyed by payee, for the notification layer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ThreatAlertProducer {

    private final KafkaTemplate<String, ThreatAlert> threatAlertKafkaTemplate;

    @Value("${threat-intel.kafka.topic.threat-alerts:threat-alerts}")
    private String topic;

    public void send(ThreatAlert alert) {
        String key = alert.getReceiver() != null ? alert.getReceiver() : alert.getAlertId();
        try {
            CompletableFuture<SendResult<String, ThreatAlert>> future = threatAlertKafkaTemplate.send(topic, key, alert);
            future.whenComplete((result, ex) -> {
                if (ex != null) log.error("Failed to send threat alert {}", alert.getAlertId(), ex);
                else log.debug("Sent threat alert {} partition={}", alert.getAlertId(), result != null ? result.getRecordMetadata().partition() : null);
            });
        } catch (Exception e) {
            log.error("Failed to enqueue threat alert {}", alert.getAlertId(), e);
        }
    }
}
