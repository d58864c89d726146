package com.chargelink.gateway.notification;

import com.chargelink.gateway.config.KafkaTopicsProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes business-platform events as JSON to Kafka, keyed by device id.
 * Alerts go to their own topic.
 */
@Slf4j
@Component
public class KafkaNotifier implements Notifier {

    private final KafkaTemplate<String, byte[]> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final KafkaTopicsProperties topics;

    public KafkaNotifier(KafkaTemplate<String, byte[]> kafkaTemplate, ObjectMapper objectMapper,
                         KafkaTopicsProperties topics) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topics = topics;
    }

    @Override
    public void publish(String eventType, Map<String, Object> payload) {
        String topic = ALERT_EVENT.equals(eventType) ? topics.chargingAlerts() : topics.chargingEvents();
        Object deviceId = payload.get("deviceId");
        String key = deviceId != null ? deviceId.toString() : null;

        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("eventType", eventType);
        envelope.put("timestamp", Instant.now());
        envelope.put("data", payload);

        try {
            byte[] body = objectMapper.writeValueAsBytes(envelope);
            kafkaTemplate.send(topic, key, body).whenComplete((result, failure) -> {
                if (failure == null) {
                    log.debug("📨 Published {} for device {} to {}", eventType, key, topic);
                } else {
                    log.error("❌ Failed to publish {} for device {}: {}", eventType, key, failure.getMessage());
                }
            });
        } catch (JsonProcessingException e) {
            log.error("❌ Could not serialize {} event for device {}", eventType, key, e);
        } catch (RuntimeException e) {
            log.error("❌ Error publishing {} event for device {}", eventType, key, e);
        }
    }
}
