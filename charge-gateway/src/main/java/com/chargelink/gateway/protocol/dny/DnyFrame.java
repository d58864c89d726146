package com.chargelink.gateway.protocol.dny;

import com.chargelink.gateway.util.DeviceIds;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

import java.time.Instant;

/**
 * One decoded DNY frame travelling through the Netty pipeline.
 */
@Value
@Builder(toBuilder = true)
@Accessors(fluent = true)
public class DnyFrame {

    long physicalId;
    int messageId;
    int command;
    @Builder.Default
    byte[] data = new byte[0];
    // Complete frame bytes as received, null for outbound frames
    byte[] raw;
    @Builder.Default
    Instant receivedAt = Instant.now();

    public String deviceId() {
        return DeviceIds.format(physicalId);
    }

    public boolean isHeartbeat() {
        return DnyConstants.HEARTBEAT_COMMANDS.contains(command);
    }

    public boolean isChargeControl() {
        return command == DnyConstants.CMD_CHARGE_CONTROL;
    }

    // Empty-payload acknowledgement echoing command and message id
    public DnyFrame ack() {
        return DnyFrame.builder()
                .physicalId(physicalId)
                .messageId(messageId)
                .command(command)
                .build();
    }

    @Override
    public String toString() {
        return String.format("DnyFrame{device=%s, messageId=0x%04X, command=0x%02X, dataLength=%d}",
                deviceId(), messageId, command, data.length);
    }
}
