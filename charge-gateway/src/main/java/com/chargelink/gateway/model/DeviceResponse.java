package com.chargelink.gateway.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Parsed reply of a charging pile to a charge-control command.
 * Ports are 1-based here; the wire carries them 0-based.
 */
@Value
@Builder
public class DeviceResponse {

    String deviceId;
    int messageId;
    int command;
    int responseCode;
    DeviceResponseCode code;
    String orderNumber;
    int port;
    int waitingPorts;
    // Only present on replies to a status query
    Integer portStatus;
    @Builder.Default
    Instant receivedAt = Instant.now();

    public Optional<Integer> portStatus() {
        return Optional.ofNullable(portStatus);
    }
}
