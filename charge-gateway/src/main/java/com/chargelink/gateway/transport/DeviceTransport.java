package com.chargelink.gateway.transport;

import java.util.Optional;

/**
 * Per-device persistent connection layer as seen by command orchestration.
 */
public interface DeviceTransport {

    /**
     * Write a complete frame to the device.
     *
     * @throws com.chargelink.gateway.exception.ChargeGatewayException
     *         {@code DEVICE_OFFLINE} when no connection exists, {@code SEND_FAILURE} when the write fails
     */
    void send(String deviceId, byte[] frame);

    boolean isOnline(String deviceId);

    Optional<DeviceConnection> resolve(String deviceId);
}
