package com.chargelink.gateway.service;

import com.chargelink.gateway.config.CommandRetryProperties;
import com.chargelink.gateway.exception.ChargeGatewayException;
import com.chargelink.gateway.service.CommandRetryManager.RetryState;
import com.chargelink.gateway.transport.DeviceTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CommandRetryManagerTest {

    private static final String DEVICE = "04CEAA40";
    private static final byte[] FRAME = {0x44, 0x4E, 0x59};

    @Mock
    private DeviceTransport transport;

    private CommandRetryManager manager;

    @BeforeEach
    void setUp() {
        manager = new CommandRetryManager(transport,
                new CommandRetryProperties(true, Duration.ofMillis(20), 2, Duration.ofSeconds(10), 10));
    }

    @Test
    @DisplayName("Nothing is resent before the retry timeout")
    void shouldNotResendBeforeTimeout() {
        manager.register(DEVICE, 1, 0x82, FRAME);

        assertThat(manager.checkRetries()).isZero();
        assertThat(manager.stateOf(DEVICE, 1)).contains(RetryState.SENT);
        verify(transport, never()).send(any(), any());
    }

    @Test
    @DisplayName("An unconfirmed frame is resent with the same bytes, then marked failed")
    void shouldResendUntilRetriesExhausted() throws InterruptedException {
        manager.register(DEVICE, 1, 0x82, FRAME);

        Thread.sleep(30);
        assertThat(manager.checkRetries()).isEqualTo(1);
        assertThat(manager.stateOf(DEVICE, 1)).contains(RetryState.RETRYING);

        Thread.sleep(30);
        assertThat(manager.checkRetries()).isEqualTo(1);

        Thread.sleep(30);
        assertThat(manager.checkRetries()).isZero();
        assertThat(manager.stateOf(DEVICE, 1)).isEmpty();
        assertThat(manager.trackedCount()).isZero();

        verify(transport, times(2)).send(eq(DEVICE), eq(FRAME));
    }

    @Test
    @DisplayName("A confirmed command is never resent")
    void shouldStopAfterConfirmation() throws InterruptedException {
        manager.register(DEVICE, 2, 0x82, FRAME);

        assertThat(manager.confirm(DEVICE, 2)).isTrue();
        assertThat(manager.confirm(DEVICE, 2)).isFalse();
        Thread.sleep(30);

        assertThat(manager.checkRetries()).isZero();
        verify(transport, never()).send(any(), any());
    }

    @Test
    @DisplayName("A resend that fails on the transport is not counted")
    void shouldSurviveTransportFailure() throws InterruptedException {
        doThrow(ChargeGatewayException.deviceOffline(DEVICE)).when(transport).send(eq(DEVICE), any());
        manager.register(DEVICE, 3, 0x82, FRAME);
        Thread.sleep(30);

        assertThat(manager.checkRetries()).isZero();
        assertThat(manager.stateOf(DEVICE, 3)).contains(RetryState.RETRYING);
    }

    @Test
    @DisplayName("Entries older than the maximum age expire")
    void shouldExpireOldEntries() throws InterruptedException {
        CommandRetryManager shortLived = new CommandRetryManager(transport,
                new CommandRetryProperties(true, Duration.ofMillis(20), 5, Duration.ofMillis(25), 10));
        shortLived.register(DEVICE, 4, 0x82, FRAME);
        Thread.sleep(40);

        assertThat(shortLived.checkRetries()).isZero();
        assertThat(shortLived.trackedCount()).isZero();
        verify(transport, never()).send(any(), any());
    }

    @Test
    @DisplayName("A cancelled entry is never resent")
    void shouldStopResendingAfterCancel() throws InterruptedException {
        manager.register(DEVICE, 6, 0x82, FRAME);

        assertThat(manager.cancel(DEVICE, 6)).isTrue();
        Thread.sleep(30);

        assertThat(manager.checkRetries()).isZero();
        assertThat(manager.trackedCount()).isZero();
        assertThat(manager.cancel(DEVICE, 6)).isFalse();
        verify(transport, never()).send(any(), any());
    }

    @Test
    @DisplayName("Registration is a no-op when retries are disabled")
    void shouldIgnoreRegistrationWhenDisabled() {
        CommandRetryManager disabled = new CommandRetryManager(transport,
                new CommandRetryProperties(false, Duration.ofMillis(20), 2, Duration.ofSeconds(10), 10));

        disabled.register(DEVICE, 5, 0x82, FRAME);

        assertThat(disabled.trackedCount()).isZero();
    }
}
