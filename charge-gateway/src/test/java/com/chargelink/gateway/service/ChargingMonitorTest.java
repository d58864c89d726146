package com.chargelink.gateway.service;

import com.chargelink.gateway.config.ChargingMonitorProperties;
import com.chargelink.gateway.dto.ChargingSessionDto;
import com.chargelink.gateway.model.AlertType;
import com.chargelink.gateway.model.ChargeCommand;
import com.chargelink.gateway.model.DeviceResponseCode;
import com.chargelink.gateway.model.SessionStatus;
import com.chargelink.gateway.support.GatewayTestHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.chargelink.gateway.support.GatewayTestHarness.DEVICE_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ChargingMonitorTest {

    private GatewayTestHarness harness;
    private final AtomicReference<ChargingMonitor> terminated = new AtomicReference<>();

    @AfterEach
    void tearDown() {
        if (harness != null) {
            harness.close();
        }
    }

    private ChargingMonitor monitor(GatewayTestHarness h, String orderNumber) {
        ChargingMonitor monitor = ChargingMonitor.builder()
                .orderNumber(orderNumber)
                .deviceId(DEVICE_ID)
                .port(1)
                .commandSender(h.sender)
                .registry(h.registry)
                .eventNotifier(h.events)
                .statusResolver(h.resolver)
                .properties(h.monitorProperties)
                .scheduler(h.monitorScheduler)
                .onTerminated(terminated::set)
                .build();
        monitor.start();
        return monitor;
    }

    // 500 ms between regular polls, 30 ms before a re-check
    private static ChargingMonitorProperties slowPolls(boolean autoRecover) {
        return new ChargingMonitorProperties(Duration.ofMillis(500), Duration.ofMillis(60), Duration.ofSeconds(10),
                3, true, autoRecover, Duration.ofMillis(30), 2, null);
    }

    // ========== Circuit breaker ==========

    @Test
    @DisplayName("Too many failed polls leave the session in ERROR with reason monitor_error")
    void shouldEndInErrorWhenBreakerTrips() {
        harness = new GatewayTestHarness(GatewayTestHarness.charging(Duration.ofSeconds(2)),
                GatewayTestHarness.monitor(Duration.ofSeconds(10), 3));
        harness.device.silence(ChargeCommand.QUERY);

        ChargingMonitor monitor = monitor(harness, "M1");

        await().atMost(Duration.ofSeconds(3)).until(() -> terminated.get() != null);
        ChargingSessionDto session = monitor.snapshot();
        assertThat(terminated.get()).isSameAs(monitor);
        assertThat(monitor.isActive()).isFalse();
        assertThat(monitor.getLastStatus()).isEqualTo(SessionStatus.ERROR);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.ERROR);
        assertThat(session.getTerminationReason()).isEqualTo("monitor_error");
        assertThat(session.getErrorCount()).isEqualTo(3);
        assertThat(harness.notifier.alerts(AlertType.MONITOR_ERROR)).hasSize(1);
    }

    // ========== Auto recover ==========

    @Test
    @DisplayName("A move into ERROR triggers an early re-check instead of waiting a full interval")
    void shouldRecheckSoonAfterChargingError() {
        harness = new GatewayTestHarness(GatewayTestHarness.charging(Duration.ofSeconds(2)), slowPolls(true));
        harness.device.portStatus(null);
        harness.device.respondWith(ChargeCommand.QUERY, DeviceResponseCode.NO_CHARGER);

        long began = System.nanoTime();
        ChargingMonitor monitor = monitor(harness, "M2");

        await().atMost(Duration.ofSeconds(2)).pollInterval(Duration.ofMillis(5))
                .until(() -> harness.device.sentCount(ChargeCommand.QUERY) >= 2);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - began);

        assertThat(elapsedMillis).isLessThan(900L);
        assertThat(monitor.isActive()).isTrue();
        assertThat(monitor.getLastStatus()).isEqualTo(SessionStatus.ERROR);
        assertThat(harness.notifier.alerts(AlertType.CHARGING_ERROR)).hasSize(1);
    }

    @Test
    @DisplayName("Without auto recover an ERROR status waits for the regular interval")
    void shouldKeepRegularIntervalWhenAutoRecoverDisabled() {
        harness = new GatewayTestHarness(GatewayTestHarness.charging(Duration.ofSeconds(2)), slowPolls(false));
        harness.device.portStatus(null);
        harness.device.respondWith(ChargeCommand.QUERY, DeviceResponseCode.NO_CHARGER);

        ChargingMonitor monitor = monitor(harness, "M3");

        await().atMost(Duration.ofSeconds(2)).until(() -> monitor.getLastStatus() == SessionStatus.ERROR);
        await().during(Duration.ofMillis(250)).atMost(Duration.ofSeconds(1))
                .until(() -> harness.device.sentCount(ChargeCommand.QUERY) == 1);
        assertThat(monitor.isActive()).isTrue();
    }
}
