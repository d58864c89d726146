package com.chargelink.gateway.service;

/**
 * Identity of an outstanding command on the wire. At most one live command per key.
 */
public record CorrelationKey(String deviceId, int command, int messageId) {

    public boolean matches(String deviceId, int messageId) {
        return this.messageId == messageId && this.deviceId.equals(deviceId);
    }

    @Override
    public String toString() {
        return String.format("%s/0x%02X/0x%04X", deviceId, command, messageId);
    }
}
