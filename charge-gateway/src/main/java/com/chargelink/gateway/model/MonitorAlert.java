package com.chargelink.gateway.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable alert raised by a charging monitor. Handed to the notifier and then dropped.
 */
@Value
@Builder
public class MonitorAlert {

    AlertType type;
    AlertLevel level;
    String orderNumber;
    String deviceId;
    String message;
    @Builder.Default
    Instant timestamp = Instant.now();
    @Builder.Default
    Map<String, Object> context = Map.of();

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type.wireName());
        payload.put("level", level.wireName());
        payload.put("orderNumber", orderNumber);
        payload.put("deviceId", deviceId);
        payload.put("message", message);
        payload.put("timestamp", timestamp);
        payload.put("context", context);
        return payload;
    }
}
