package com.chargelink.gateway.service;

import com.chargelink.gateway.config.ChargingMonitorProperties;
import com.chargelink.gateway.dto.ChargingSessionDto;
import com.chargelink.gateway.exception.ChargeGatewayException;
import com.chargelink.gateway.notification.ChargingEventNotifier;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Charging Monitor Service
 *
 * Owns the order number to monitor map. One monitor per order; monitors remove
 * themselves from the map when they terminate.
 */
@Slf4j
@Service
public class ChargingMonitorService {

    private final Map<String, ChargingMonitor> monitors = new ConcurrentHashMap<>();
    private final ChargeCommandSender commandSender;
    private final PendingCommandRegistry registry;
    private final ChargingEventNotifier eventNotifier;
    private final SessionStatusResolver statusResolver;
    private final ChargingMonitorProperties properties;
    private final ScheduledExecutorService scheduler;

    public ChargingMonitorService(ChargeCommandSender commandSender,
                                  PendingCommandRegistry registry,
                                  ChargingEventNotifier eventNotifier,
                                  SessionStatusResolver statusResolver,
                                  ChargingMonitorProperties properties,
                                  @Qualifier("monitorScheduler") ScheduledExecutorService scheduler) {
        this.commandSender = commandSender;
        this.registry = registry;
        this.eventNotifier = eventNotifier;
        this.statusResolver = statusResolver;
        this.properties = properties;
        this.scheduler = scheduler;
    }

    /**
     * Start polling an order.
     *
     * @throws ChargeGatewayException {@code DUPLICATE_SESSION} if the order is already monitored
     */
    public ChargingSessionDto startMonitoring(String orderNumber, String deviceId, int port) {
        ChargingMonitor monitor = ChargingMonitor.builder()
                .orderNumber(orderNumber)
                .deviceId(deviceId)
                .port(port)
                .commandSender(commandSender)
                .registry(registry)
                .eventNotifier(eventNotifier)
                .statusResolver(statusResolver)
                .properties(properties)
                .scheduler(scheduler)
                .onTerminated(this::deregister)
                .build();

        ChargingMonitor existing = monitors.putIfAbsent(orderNumber, monitor);
        if (existing != null) {
            log.warn("⚠️ Order {} already monitored on device {} port {}",
                    orderNumber, existing.getDeviceId(), existing.getPort());
            throw ChargeGatewayException.duplicateSession(orderNumber);
        }
        monitor.start();
        return monitor.snapshot();
    }

    /**
     * @return false when no monitor was running for the order
     */
    public boolean stopMonitoring(String orderNumber, boolean finalizeSession) {
        ChargingMonitor monitor = monitors.get(orderNumber);
        if (monitor == null) {
            log.debug("No monitor to stop for order {}", orderNumber);
            return false;
        }
        return monitor.stop(finalizeSession);
    }

    /**
     * Stop whatever monitor runs on a device port. Used when a stop request carries no order number.
     */
    public int stopMonitoringFor(String deviceId, int port, boolean finalizeSession) {
        int stopped = 0;
        for (ChargingMonitor monitor : List.copyOf(monitors.values())) {
            if (monitor.getDeviceId().equals(deviceId) && monitor.getPort() == port
                    && monitor.stop(finalizeSession)) {
                stopped++;
            }
        }
        return stopped;
    }

    public Optional<ChargingSessionDto> getStatus(String orderNumber) {
        return Optional.ofNullable(monitors.get(orderNumber)).map(ChargingMonitor::snapshot);
    }

    public List<ChargingSessionDto> getAllStatuses() {
        return monitors.values().stream()
                .map(ChargingMonitor::snapshot)
                .sorted(Comparator.comparing(ChargingSessionDto::getStartTime))
                .toList();
    }

    public boolean isMonitoring(String orderNumber) {
        return monitors.containsKey(orderNumber);
    }

    public int activeCount() {
        return monitors.size();
    }

    @PreDestroy
    public int close() {
        int stopped = 0;
        for (ChargingMonitor monitor : List.copyOf(monitors.values())) {
            if (monitor.stop(false)) {
                stopped++;
            }
        }
        log.info("🛑 Charging monitor service closed, {} monitors stopped", stopped);
        return stopped;
    }

    private void deregister(ChargingMonitor monitor) {
        monitors.remove(monitor.getOrderNumber(), monitor);
    }
}
