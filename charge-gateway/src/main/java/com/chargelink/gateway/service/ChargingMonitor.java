package com.chargelink.gateway.service;

import com.chargelink.gateway.config.ChargingMonitorProperties;
import com.chargelink.gateway.dto.ChargingSessionDto;
import com.chargelink.gateway.exception.ChargeGatewayException;
import com.chargelink.gateway.model.AlertLevel;
import com.chargelink.gateway.model.AlertType;
import com.chargelink.gateway.model.DeviceResponse;
import com.chargelink.gateway.model.MonitorAlert;
import com.chargelink.gateway.model.SessionStatus;
import com.chargelink.gateway.notification.ChargingEventNotifier;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Polling state machine of one charging order.
 *
 * Each poll schedules the next one once its reply is handled, so polls of one
 * order never overlap and session fields have a single writer. {@code active}
 * is the one piece of state shared with the max-time timer and {@link #stop};
 * the first party to flip it owns termination.
 */
@Slf4j
public class ChargingMonitor {

    @Getter
    private final String orderNumber;
    @Getter
    private final String deviceId;
    @Getter
    private final int port;
    @Getter
    private final Instant startTime = Instant.now();

    private final ChargeCommandSender commandSender;
    private final PendingCommandRegistry registry;
    private final ChargingEventNotifier eventNotifier;
    private final SessionStatusResolver statusResolver;
    private final ChargingMonitorProperties properties;
    private final ScheduledExecutorService scheduler;
    private final Consumer<ChargingMonitor> onTerminated;

    private final AtomicBoolean active = new AtomicBoolean();
    private volatile SessionStatus lastStatus = SessionStatus.STARTING;
    private volatile Instant lastCheckTime;
    private volatile int checkCount;
    private volatile int errorCount;
    private volatile String terminationReason;
    private volatile PendingCommand inFlight;
    private volatile ScheduledFuture<?> pollTask;
    private volatile ScheduledFuture<?> maxTimeTask;

    @Builder
    ChargingMonitor(String orderNumber, String deviceId, int port,
                    ChargeCommandSender commandSender, PendingCommandRegistry registry,
                    ChargingEventNotifier eventNotifier, SessionStatusResolver statusResolver,
                    ChargingMonitorProperties properties, ScheduledExecutorService scheduler,
                    Consumer<ChargingMonitor> onTerminated) {
        this.orderNumber = orderNumber;
        this.deviceId = deviceId;
        this.port = port;
        this.commandSender = commandSender;
        this.registry = registry;
        this.eventNotifier = eventNotifier;
        this.statusResolver = statusResolver;
        this.properties = properties;
        this.scheduler = scheduler;
        this.onTerminated = onTerminated;
    }

    void start() {
        if (!active.compareAndSet(false, true)) {
            return;
        }
        maxTimeTask = scheduler.schedule(this::handleMaxTimeReached,
                properties.maxMonitorTime().toMillis(), TimeUnit.MILLISECONDS);
        scheduleNextPoll(properties.checkInterval());
        log.info("👀 Monitoring order {} on device {} port {} every {} ms",
                orderNumber, deviceId, port, properties.checkInterval().toMillis());
    }

    /**
     * Stop monitoring. With {@code finalizeSession} the platform is told the charge ended.
     *
     * @return false if the monitor had already terminated
     */
    boolean stop(boolean finalizeSession) {
        if (!terminate(SessionStatus.TERMINATED, "stopped")) {
            return false;
        }
        if (finalizeSession) {
            eventNotifier.chargingEnded(deviceId, port, orderNumber, "stopped");
        }
        return true;
    }

    public boolean isActive() {
        return active.get();
    }

    public SessionStatus getLastStatus() {
        return lastStatus;
    }

    public ChargingSessionDto snapshot() {
        return ChargingSessionDto.builder()
                .orderNumber(orderNumber)
                .deviceId(deviceId)
                .port(port)
                .status(lastStatus)
                .startTime(startTime)
                .lastCheckTime(lastCheckTime)
                .duration(Duration.between(startTime, Instant.now()))
                .checkCount(checkCount)
                .errorCount(errorCount)
                .active(active.get())
                .terminationReason(terminationReason)
                .build();
    }

    // ==================== Poll loop ====================

    /**
     * Send one status query. The reply is handled on the scheduler when it
     * arrives, so no scheduler thread waits on the device.
     */
    void poll() {
        if (!active.get()) {
            return;
        }
        try {
            if (Duration.between(startTime, Instant.now()).compareTo(properties.maxMonitorTime()) >= 0) {
                handleMaxTimeReached();
                return;
            }
            checkCount++;
            lastCheckTime = Instant.now();

            PendingCommand query = commandSender.sendQuery(deviceId, port, orderNumber, properties.pollTimeout());
            inFlight = query;
            if (!active.get()) {
                registry.cancel(query);
            }
            query.getResult().whenCompleteAsync((response, error) -> onPollResult(query, response, error), scheduler);
        } catch (ChargeGatewayException e) {
            handlePollFailure(e);
            scheduleNextPoll(properties.checkInterval());
        } catch (RuntimeException e) {
            // Keep the failure inside this monitor
            log.error("💥 Unexpected error polling order {}: {}", orderNumber, e.getMessage(), e);
            handlePollFailure(e);
            scheduleNextPoll(properties.checkInterval());
        }
    }

    private void onPollResult(PendingCommand query, DeviceResponse response, Throwable error) {
        if (inFlight == query) {
            inFlight = null;
        }
        if (!active.get()) {
            return;
        }
        Duration nextDelay = properties.checkInterval();
        try {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (cause instanceof CancellationException) {
                log.debug("Poll for order {} cancelled", orderNumber);
            } else if (cause != null) {
                handlePollFailure(cause);
            } else {
                errorCount = 0;
                SessionStatus previous = lastStatus;
                if (evaluate(response) == SessionStatus.ERROR && previous != SessionStatus.ERROR
                        && properties.autoRecover()) {
                    nextDelay = properties.autoRecoverDelay();
                    log.info("🩺 Re-checking order {} in {} ms after a charging error",
                            orderNumber, nextDelay.toMillis());
                }
            }
        } catch (RuntimeException e) {
            log.error("💥 Unexpected error handling poll reply for order {}: {}", orderNumber, e.getMessage(), e);
            handlePollFailure(e);
        } finally {
            scheduleNextPoll(nextDelay);
        }
    }

    private void scheduleNextPoll(Duration delay) {
        if (!active.get()) {
            return;
        }
        try {
            pollTask = scheduler.schedule(this::poll, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("⚠️ Scheduler rejected next poll for order {}, stopping monitor", orderNumber);
            terminate(SessionStatus.TERMINATED, "shutdown");
        }
    }

    /**
     * @return the status the reply resolved to, or the unchanged one
     */
    private SessionStatus evaluate(DeviceResponse response) {
        Optional<SessionStatus> resolved = statusResolver.resolve(response);
        if (resolved.isEmpty()) {
            return lastStatus;
        }
        SessionStatus status = resolved.get();

        if (status == SessionStatus.DEVICE_OFFLINE) {
            handleDeviceOffline();
            return status;
        }
        if (status == SessionStatus.PORT_FAULT) {
            handlePortFault(response);
            return status;
        }
        if (status == lastStatus) {
            log.debug("Order {} still {} (check #{})", orderNumber, status, checkCount);
            return status;
        }

        SessionStatus previous = lastStatus;
        lastStatus = status;
        log.info("🔄 Order {} status {} -> {}", orderNumber, previous, status);
        eventNotifier.chargingStatus(deviceId, port, orderNumber, status);

        switch (status) {
            case CHARGING_COMPLETED -> finish(status, "completed");
            case CHARGING_STOPPED -> finish(status, "stopped");
            case ERROR -> sendAlert(AlertType.CHARGING_ERROR, AlertLevel.ERROR,
                    "device reported a charging error",
                    Map.of("responseCode", response.getResponseCode(), "description", response.getCode().getDescription()));
            default -> {
                // intermediate state, keep polling
            }
        }
        return status;
    }

    private void finish(SessionStatus status, String reason) {
        if (terminate(status, reason)) {
            log.info("🏁 Order {} ended ({}) after {}", orderNumber, reason, Duration.between(startTime, Instant.now()));
            eventNotifier.chargingEnded(deviceId, port, orderNumber, reason);
        }
    }

    private void handlePollFailure(Throwable e) {
        errorCount++;
        log.warn("⚠️ Poll {} for order {} failed ({}/{}): {}",
                checkCount, orderNumber, errorCount, properties.retryCount(), e.getMessage());
        if (errorCount >= properties.retryCount() && terminate(SessionStatus.ERROR, "monitor_error")) {
            sendAlert(AlertType.MONITOR_ERROR, AlertLevel.ERROR, "too many consecutive poll failures",
                    Map.of("errorCount", errorCount, "error", String.valueOf(e.getMessage())));
        }
    }

    private void handleDeviceOffline() {
        if (!terminate(SessionStatus.DEVICE_OFFLINE, "device_offline")) {
            return;
        }
        log.warn("📴 Device {} reported offline while charging order {}", deviceId, orderNumber);
        sendAlert(AlertType.DEVICE_OFFLINE, AlertLevel.WARNING, "device offline",
                Map.of("checkCount", checkCount, "lastCheckTime", String.valueOf(lastCheckTime)));
        eventNotifier.deviceOffline(deviceId, "charging_monitor_detected");
    }

    private void handlePortFault(DeviceResponse response) {
        if (!terminate(SessionStatus.PORT_FAULT, "port_fault")) {
            return;
        }
        log.error("🔥 Port fault on device {} port {} (order {}): {}",
                deviceId, port, orderNumber, response.getCode().getDescription());
        sendAlert(AlertType.PORT_ERROR, AlertLevel.ERROR, "port fault: " + response.getCode().getDescription(),
                Map.of("port", port, "responseCode", response.getResponseCode()));
        eventNotifier.deviceError(deviceId, "port_error", port, response.getCode().getDescription(),
                Map.of("orderNumber", orderNumber, "port", port));
    }

    void handleMaxTimeReached() {
        if (!terminate(SessionStatus.TERMINATED, "max_time_reached")) {
            return;
        }
        log.warn("⏰ Order {} hit the maximum monitor time of {}", orderNumber, properties.maxMonitorTime());
        sendAlert(AlertType.MAX_TIME_REACHED, AlertLevel.WARNING, "maximum monitor time reached",
                Map.of("maxMonitorTime", properties.maxMonitorTime().toString(),
                        "actualDuration", Duration.between(startTime, Instant.now()).toString()));
    }

    // ==================== Termination ====================

    /**
     * Flip to inactive, cancel timers and any in-flight poll, leave the registry.
     * Only the first caller gets true.
     */
    boolean terminate(SessionStatus finalStatus, String reason) {
        if (!active.compareAndSet(true, false)) {
            return false;
        }
        lastStatus = finalStatus;
        terminationReason = reason;

        cancel(pollTask);
        cancel(maxTimeTask);
        PendingCommand query = inFlight;
        if (query != null) {
            registry.cancel(query);
        }
        try {
            onTerminated.accept(this);
        } catch (RuntimeException e) {
            log.error("❌ Failed to deregister monitor for order {}", orderNumber, e);
        }
        log.info("🛑 Monitor for order {} terminated: {}", orderNumber, reason);
        return true;
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    private void sendAlert(AlertType type, AlertLevel level, String message, Map<String, Object> context) {
        if (!properties.enableAlerts()) {
            return;
        }
        MonitorAlert alert = MonitorAlert.builder()
                .type(type)
                .level(level)
                .orderNumber(orderNumber)
                .deviceId(deviceId)
                .message(message)
                .context(context)
                .build();
        log.warn("🚨 [{}] {} alert for order {}: {}", level.wireName(), type.wireName(), orderNumber, message);
        eventNotifier.alert(alert);
    }
}
