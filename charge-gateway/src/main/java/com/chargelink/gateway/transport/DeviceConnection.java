package com.chargelink.gateway.transport;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only view of a device's live connection.
 */
@Value
@Builder
public class DeviceConnection {

    String deviceId;
    String remoteAddress;
    Instant connectedAt;
    Instant lastSeen;
}
