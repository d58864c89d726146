package com.chargelink.gateway.notification;

import java.util.Map;

/**
 * Fire-and-forget outlet to the business platform.
 */
public interface Notifier {

    String ALERT_EVENT = "charging_monitor_alert";

    /**
     * Publish one event. Implementations must not block on delivery.
     */
    void publish(String eventType, Map<String, Object> payload);
}
