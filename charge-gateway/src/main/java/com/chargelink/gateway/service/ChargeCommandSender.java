package com.chargelink.gateway.service;

import com.chargelink.gateway.config.ChargingProperties;
import com.chargelink.gateway.dto.ChargingRequest;
import com.chargelink.gateway.exception.ChargeGatewayException;
import com.chargelink.gateway.model.ChargeCommand;
import com.chargelink.gateway.model.DeviceResponse;
import com.chargelink.gateway.protocol.dny.ChargeControlPayload;
import com.chargelink.gateway.protocol.dny.DnyCodec;
import com.chargelink.gateway.protocol.dny.DnyConstants;
import com.chargelink.gateway.transport.DeviceTransport;
import com.chargelink.gateway.util.PortMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * The one path every charge-control command takes to a device: resolve the
 * connection, build the frame, track it, write it and register it for resend
 * until the command is resolved.
 */
@Slf4j
@Component
public class ChargeCommandSender {

    private final DeviceTransport transport;
    private final DnyCodec codec;
    private final PendingCommandRegistry registry;
    private final CommandRetryManager retryManager;
    private final MessageIdGenerator messageIds;
    private final ChargingProperties properties;

    public ChargeCommandSender(DeviceTransport transport, DnyCodec codec, PendingCommandRegistry registry,
                               CommandRetryManager retryManager, MessageIdGenerator messageIds,
                               ChargingProperties properties) {
        this.transport = transport;
        this.codec = codec;
        this.registry = registry;
        this.retryManager = retryManager;
        this.messageIds = messageIds;
        this.properties = properties;
    }

    public int nextMessageId() {
        return messageIds.next();
    }

    /**
     * Send a charge-control command and return its tracking handle.
     *
     * @throws ChargeGatewayException {@code DEVICE_OFFLINE}, {@code INVALID_REQUEST} or
     *                                {@code SEND_FAILURE}; nothing stays tracked in those cases
     */
    public PendingCommand sendCommand(ChargingRequest request, int messageId, Duration timeout,
                                      BiConsumer<DeviceResponse, Throwable> callback) {
        String deviceId = request.getDeviceId();
        if (transport.resolve(deviceId).isEmpty()) {
            log.warn("📴 Device {} offline, {} not sent", deviceId, request.getCommand());
            throw ChargeGatewayException.deviceOffline(deviceId);
        }

        byte[] frame = codec.buildCommandFrame(deviceId, messageId, DnyConstants.CMD_CHARGE_CONTROL, toPayload(request));
        PendingCommand pending = registry.trackCommand(deviceId, DnyConstants.CMD_CHARGE_CONTROL, messageId, timeout, callback);

        try {
            transport.send(deviceId, frame);
        } catch (ChargeGatewayException e) {
            registry.discard(pending, e);
            throw e;
        } catch (RuntimeException e) {
            ChargeGatewayException failure = ChargeGatewayException.sendFailure(deviceId, e);
            registry.discard(pending, failure);
            throw failure;
        }

        retryManager.register(deviceId, messageId, DnyConstants.CMD_CHARGE_CONTROL, frame);
        // Runs at once if the reply already arrived
        pending.getResult().whenComplete((response, error) -> retryManager.cancel(deviceId, messageId));
        log.info("📤 Sent {} to device {} port {} (order={}, messageId=0x{})",
                request.getCommand(), deviceId, request.getPort(), request.getOrderNumber(),
                Integer.toHexString(messageId));
        return pending;
    }

    /**
     * Issue a status query for one port.
     */
    public PendingCommand sendQuery(String deviceId, int port, String orderNumber, Duration timeout) {
        ChargingRequest query = ChargingRequest.builder()
                .deviceId(deviceId)
                .port(port)
                .orderNumber(orderNumber)
                .command(ChargeCommand.QUERY)
                .build();
        return sendCommand(query, nextMessageId(), timeout, null);
    }

    private ChargeControlPayload toPayload(ChargingRequest request) {
        int port = PortMapper.toProtocolPort(request.getPort(), properties.maxPorts());
        return ChargeControlPayload.builder()
                .rateMode(Objects.requireNonNullElse(request.getMode(), properties.defaultRateMode()))
                .balance(Objects.requireNonNullElse(request.getBalance(), 0L))
                .port(port)
                .command(request.getCommand())
                .duration(Objects.requireNonNullElse(request.getDuration(), properties.defaultDuration()))
                .orderNumber(request.getOrderNumber())
                .maxChargeDuration(properties.defaultMaxChargeDuration())
                .maxPower(Objects.requireNonNullElse(request.getMaxPower(), properties.defaultMaxPower()))
                .qrCodeLight(properties.defaultQrCodeLight())
                .build();
    }
}
