package com.chargelink.gateway.service;

import com.chargelink.gateway.config.CommandRetryProperties;
import com.chargelink.gateway.exception.ChargeGatewayException;
import com.chargelink.gateway.transport.DeviceTransport;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Command Retry Manager
 *
 * Resends command frames the device has not acknowledged. Resends reuse the
 * original message id, so a late reply still correlates with the waiting caller.
 */
@Slf4j
@Service
public class CommandRetryManager {

    public enum RetryState { PENDING, SENT, RETRYING, CONFIRMED, FAILED, EXPIRED }

    private final Map<String, RetryEntry> entries = new ConcurrentHashMap<>();
    private final DeviceTransport transport;
    private final CommandRetryProperties properties;

    public CommandRetryManager(DeviceTransport transport, CommandRetryProperties properties) {
        this.transport = transport;
        this.properties = properties;
    }

    /**
     * Register a frame that has just been written to the device.
     */
    public void register(String deviceId, int messageId, int command, byte[] frame) {
        if (!properties.enabled()) {
            return;
        }
        RetryEntry entry = new RetryEntry(deviceId, messageId, command, frame);
        entries.put(key(deviceId, messageId), entry);
        log.debug("🔁 Registered 0x{} for device {} messageId 0x{}",
                Integer.toHexString(command), deviceId, Integer.toHexString(messageId));
    }

    /**
     * The device answered; stop resending.
     */
    public boolean confirm(String deviceId, int messageId) {
        RetryEntry entry = entries.remove(key(deviceId, messageId));
        if (entry == null) {
            return false;
        }
        entry.state = RetryState.CONFIRMED;
        log.debug("✅ Confirmed device {} messageId 0x{} after {} retries",
                deviceId, Integer.toHexString(messageId), entry.retries);
        return true;
    }

    /**
     * Nobody waits for the command any more (timeout, cancel or shutdown); stop resending.
     */
    public boolean cancel(String deviceId, int messageId) {
        RetryEntry entry = entries.remove(key(deviceId, messageId));
        if (entry == null) {
            return false;
        }
        log.debug("🚫 Dropped retry of 0x{} for device {} messageId 0x{} after {} retries",
                Integer.toHexString(entry.command), deviceId, Integer.toHexString(messageId), entry.retries);
        return true;
    }

    public Optional<RetryState> stateOf(String deviceId, int messageId) {
        return Optional.ofNullable(entries.get(key(deviceId, messageId))).map(RetryEntry::getState);
    }

    public int trackedCount() {
        return entries.size();
    }

    /**
     * Resend overdue commands, fail those out of retries and expire stale ones.
     *
     * @return number of frames resent
     */
    @Scheduled(fixedRateString = "${charge-gateway.retry.check-interval-ms:1000}")
    public int checkRetries() {
        Instant now = Instant.now();
        int resent = 0;
        for (Map.Entry<String, RetryEntry> mapEntry : entries.entrySet()) {
            RetryEntry entry = mapEntry.getValue();

            if (Duration.between(entry.createdAt, now).compareTo(properties.maxAge()) >= 0) {
                entry.state = RetryState.EXPIRED;
                entries.remove(mapEntry.getKey(), entry);
                log.warn("⌛ Retry entry for device {} messageId 0x{} expired",
                        entry.deviceId, Integer.toHexString(entry.messageId));
                continue;
            }
            if (Duration.between(entry.lastSentAt, now).compareTo(properties.timeout()) < 0) {
                continue;
            }
            if (entry.retries >= properties.maxRetries()) {
                entry.state = RetryState.FAILED;
                entries.remove(mapEntry.getKey(), entry);
                log.warn("❌ Device {} never confirmed messageId 0x{} after {} retries",
                        entry.deviceId, Integer.toHexString(entry.messageId), entry.retries);
                continue;
            }
            if (resend(entry, now)) {
                resent++;
            }
        }
        return resent;
    }

    private boolean resend(RetryEntry entry, Instant now) {
        entry.retries++;
        entry.lastSentAt = now;
        entry.state = RetryState.RETRYING;
        try {
            transport.send(entry.deviceId, entry.frame);
            log.info("🔁 Resent 0x{} to device {} (messageId 0x{}, attempt {}/{})",
                    Integer.toHexString(entry.command), entry.deviceId,
                    Integer.toHexString(entry.messageId), entry.retries, properties.maxRetries());
            return true;
        } catch (ChargeGatewayException e) {
            log.warn("⚠️ Resend to device {} failed: {}", entry.deviceId, e.getMessage());
            return false;
        }
    }

    private static String key(String deviceId, int messageId) {
        return deviceId + ":" + messageId;
    }

    @Getter
    private static final class RetryEntry {
        private final String deviceId;
        private final int messageId;
        private final int command;
        private final byte[] frame;
        private final Instant createdAt = Instant.now();
        private volatile Instant lastSentAt = createdAt;
        private volatile int retries;
        private volatile RetryState state = RetryState.SENT;

        private RetryEntry(String deviceId, int messageId, int command, byte[] frame) {
            this.deviceId = deviceId;
            this.messageId = messageId;
            this.command = command;
            this.frame = frame;
        }
    }
}
