package com.chargelink.gateway.config;

import com.chargelink.gateway.model.SessionStatus;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Map;

/**
 * Charging session monitor settings.
 *
 * @param checkInterval     delay between two status polls of one order
 * @param pollTimeout       reply timeout of one poll, strictly shorter than {@code checkInterval}
 * @param maxMonitorTime    hard ceiling on a monitor's lifetime
 * @param retryCount        consecutive poll failures that end a monitor
 * @param enableAlerts      whether monitor alerts are published
 * @param autoRecover       re-check an order soon after it reports a charging error
 * @param autoRecoverDelay  delay of that re-check, used instead of {@code checkInterval}
 * @param schedulerThreads  threads shared by all monitors
 * @param portStatusMapping device port-status byte to session status
 */
@ConfigurationProperties(prefix = "charge-gateway.monitor")
public record ChargingMonitorProperties(
    @DefaultValue("30s") Duration checkInterval,
    @DefaultValue("10s") Duration pollTimeout,
    @DefaultValue("8h") Duration maxMonitorTime,
    @DefaultValue("3") int retryCount,
    @DefaultValue("true") boolean enableAlerts,
    @DefaultValue("true") boolean autoRecover,
    @DefaultValue("5s") Duration autoRecoverDelay,
    @DefaultValue("8") int schedulerThreads,
    Map<Integer, SessionStatus> portStatusMapping
) {

    public static final Map<Integer, SessionStatus> DEFAULT_PORT_STATUS_MAPPING = Map.of(
            0, SessionStatus.CHARGING_STOPPED,
            1, SessionStatus.CHARGING,
            2, SessionStatus.CONNECTED,
            3, SessionStatus.CHARGING_COMPLETED,
            5, SessionStatus.FLOATING_CHARGE);

    public ChargingMonitorProperties {
        if (checkInterval == null || checkInterval.isNegative() || checkInterval.isZero()) {
            throw new IllegalArgumentException("Check interval must be positive");
        }
        if (pollTimeout == null || pollTimeout.isNegative() || pollTimeout.isZero()) {
            throw new IllegalArgumentException("Poll timeout must be positive");
        }
        if (pollTimeout.compareTo(checkInterval) >= 0) {
            throw new IllegalArgumentException("Poll timeout must be shorter than the check interval");
        }
        if (maxMonitorTime == null || maxMonitorTime.compareTo(checkInterval) < 0) {
            throw new IllegalArgumentException("Max monitor time must be at least one check interval");
        }
        if (autoRecoverDelay == null || autoRecoverDelay.isNegative() || autoRecoverDelay.isZero()) {
            throw new IllegalArgumentException("Auto-recover delay must be positive");
        }
        if (retryCount < 1) {
            throw new IllegalArgumentException("Retry count must be at least 1");
        }
        if (schedulerThreads < 1) {
            throw new IllegalArgumentException("Scheduler threads must be at least 1");
        }
        portStatusMapping = portStatusMapping == null || portStatusMapping.isEmpty()
                ? DEFAULT_PORT_STATUS_MAPPING
                : Map.copyOf(portStatusMapping);
    }
}
