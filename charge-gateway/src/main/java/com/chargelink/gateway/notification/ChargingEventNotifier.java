package com.chargelink.gateway.notification;

import com.chargelink.gateway.model.MonitorAlert;
import com.chargelink.gateway.model.SessionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Business-platform events of the charging lifecycle. Every call is best effort:
 * a failing notifier is logged and never reaches the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChargingEventNotifier {

    public static final String CHARGING_START = "charging_start";
    public static final String CHARGING_STATUS = "charging_status";
    public static final String CHARGING_END = "charging_end";
    public static final String DEVICE_OFFLINE = "device_offline";
    public static final String DEVICE_ERROR = "device_error";

    private final Notifier notifier;

    public void chargingStarted(String deviceId, int port, String orderNumber, Long balance, Integer duration) {
        Map<String, Object> payload = session(deviceId, port, orderNumber);
        payload.put("balance", balance);
        payload.put("duration", duration);
        publish(CHARGING_START, payload);
    }

    public void chargingStatus(String deviceId, int port, String orderNumber, SessionStatus status) {
        Map<String, Object> payload = session(deviceId, port, orderNumber);
        payload.put("status", status.wireName());
        publish(CHARGING_STATUS, payload);
    }

    public void chargingEnded(String deviceId, int port, String orderNumber, String reason) {
        Map<String, Object> payload = session(deviceId, port, orderNumber);
        payload.put("reason", reason);
        publish(CHARGING_END, payload);
    }

    public void deviceOffline(String deviceId, String source) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("deviceId", deviceId);
        payload.put("source", source);
        publish(DEVICE_OFFLINE, payload);
    }

    public void deviceError(String deviceId, String errorType, int port, String message, Map<String, Object> context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("deviceId", deviceId);
        payload.put("errorType", errorType);
        payload.put("port", port);
        payload.put("message", message);
        payload.put("context", context);
        publish(DEVICE_ERROR, payload);
    }

    public void alert(MonitorAlert alert) {
        publish(Notifier.ALERT_EVENT, alert.toPayload());
    }

    private Map<String, Object> session(String deviceId, int port, String orderNumber) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("deviceId", deviceId);
        payload.put("port", port);
        payload.put("orderNumber", orderNumber);
        return payload;
    }

    private void publish(String eventType, Map<String, Object> payload) {
        try {
            notifier.publish(eventType, payload);
        } catch (RuntimeException e) {
            log.error("❌ Notification {} for device {} failed: {}", eventType, payload.get("deviceId"), e.getMessage(), e);
        }
    }
}
