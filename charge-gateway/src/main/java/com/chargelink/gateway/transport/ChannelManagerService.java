package com.chargelink.gateway.transport;

import com.chargelink.gateway.exception.ChargeGatewayException;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.util.AttributeKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Channel Manager Service - Tracks Active Device Channels
 *
 * Binds each device ID to the Netty channel it last spoke on and writes
 * command frames to it.
 */
@Slf4j
@Service
public class ChannelManagerService implements DeviceTransport {

    public static final AttributeKey<String> DEVICE_ID_ATTR = AttributeKey.valueOf("DEVICE_ID");
    private static final AttributeKey<Instant> CONNECTED_AT_ATTR = AttributeKey.valueOf("CONNECTED_AT");
    private static final AttributeKey<Instant> LAST_SEEN_ATTR = AttributeKey.valueOf("LAST_SEEN");

    private final ConcurrentHashMap<String, Channel> activeChannels = new ConcurrentHashMap<>();
    private final long writeTimeoutMillis;

    public ChannelManagerService(@Value("${charge-gateway.tcp.write-timeout-ms:5000}") long writeTimeoutMillis) {
        this.writeTimeoutMillis = writeTimeoutMillis;
    }

    /**
     * Register (or refresh) the channel of a device.
     */
    public void registerChannel(String deviceId, Channel channel) {
        if (deviceId == null || channel == null || !channel.isActive()) {
            return;
        }
        channel.attr(DEVICE_ID_ATTR).set(deviceId);
        channel.attr(CONNECTED_AT_ATTR).setIfAbsent(Instant.now());
        channel.attr(LAST_SEEN_ATTR).set(Instant.now());

        Channel previous = activeChannels.put(deviceId, channel);
        if (previous == null) {
            log.info("📡 Device {} connected from {}", deviceId, channel.remoteAddress());
        } else if (previous != channel) {
            log.info("🔄 Device {} reconnected from {}, closing stale channel {}",
                    deviceId, channel.remoteAddress(), previous.remoteAddress());
            previous.close();
        }
    }

    /**
     * Unregister the channel of a device, only if it is still the current one.
     */
    public void unregisterChannel(String deviceId, Channel channel) {
        if (deviceId == null) {
            return;
        }
        if (activeChannels.remove(deviceId, channel)) {
            log.info("📴 Device {} disconnected", deviceId);
        }
    }

    public Optional<Channel> getActiveChannel(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) {
            return Optional.empty();
        }
        Channel channel = activeChannels.get(deviceId);
        if (channel != null && channel.isActive()) {
            return Optional.of(channel);
        } else if (channel != null) {
            activeChannels.remove(deviceId, channel);
            log.debug("🧹 Cleaned up inactive channel for device: {}", deviceId);
        }
        return Optional.empty();
    }

    @Override
    public boolean isOnline(String deviceId) {
        return getActiveChannel(deviceId).isPresent();
    }

    @Override
    public Optional<DeviceConnection> resolve(String deviceId) {
        return getActiveChannel(deviceId).map(channel -> DeviceConnection.builder()
                .deviceId(deviceId)
                .remoteAddress(Objects.toString(channel.remoteAddress()))
                .connectedAt(channel.attr(CONNECTED_AT_ATTR).get())
                .lastSeen(channel.attr(LAST_SEEN_ATTR).get())
                .build());
    }

    @Override
    public void send(String deviceId, byte[] frame) {
        Channel channel = getActiveChannel(deviceId)
                .orElseThrow(() -> ChargeGatewayException.deviceOffline(deviceId));

        ChannelFuture future = channel.writeAndFlush(Unpooled.wrappedBuffer(frame));
        if (!future.awaitUninterruptibly(writeTimeoutMillis)) {
            throw ChargeGatewayException.sendFailure(deviceId, "write not completed within " + writeTimeoutMillis + " ms");
        }
        if (!future.isSuccess()) {
            log.error("❌ Failed to write {} bytes to device {}: {}", frame.length, deviceId,
                    future.cause() != null ? future.cause().getMessage() : "unknown");
            throw ChargeGatewayException.sendFailure(deviceId, future.cause());
        }
        log.debug("📤 Wrote {} bytes to device {}", frame.length, deviceId);
    }

    public int getActiveChannelCount() {
        return (int) activeChannels.values().stream().filter(Channel::isActive).count();
    }

    /**
     * Remove channels that went inactive without a close event reaching the handler.
     */
    @Scheduled(fixedRate = 60000)
    public int cleanupInactiveChannels() {
        int before = activeChannels.size();
        activeChannels.entrySet().removeIf(entry -> !entry.getValue().isActive());
        int removed = before - activeChannels.size();
        if (removed > 0) {
            log.info("🧹 Removed {} inactive device channels", removed);
        }
        return removed;
    }
}
