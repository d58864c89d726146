package com.chargelink.gateway.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Result codes a charging pile returns in reply to a charge-control command.
 */
@Getter
@RequiredArgsConstructor
public enum DeviceResponseCode {

    SUCCESS(0x00, "executed successfully"),
    NO_CHARGER(0x01, "no charger connected to port"),
    SAME_STATE(0x02, "port already in requested state"),
    PORT_FAULT(0x03, "port fault"),
    NO_SUCH_PORT(0x04, "port does not exist"),
    MULTIPLE_WAITING_PORTS(0x05, "multiple ports waiting for charger"),
    OVER_POWER(0x06, "power exceeds limit"),
    STORAGE_ERROR(0x07, "device storage error"),
    RELAY_FAULT(0x08, "relay fault"),
    RELAY_STUCK(0x09, "relay contacts stuck"),
    SHORT_CIRCUIT(0x0A, "short circuit"),
    SMOKE_ALARM(0x0B, "smoke alarm"),
    OVER_VOLTAGE(0x0C, "over voltage"),
    UNDER_VOLTAGE(0x0D, "under voltage"),
    NO_RESPONSE(0x0E, "device did not respond"),
    DEVICE_OFFLINE(0xFF, "device offline"),
    UNKNOWN(-1, "unknown response code");

    private static final Set<DeviceResponseCode> PORT_FAULTS = EnumSet.of(
            PORT_FAULT, RELAY_FAULT, SHORT_CIRCUIT, SMOKE_ALARM, OVER_VOLTAGE, UNDER_VOLTAGE);

    private final int code;
    private final String description;

    public boolean isSuccess() {
        return this == SUCCESS;
    }

    // Hardware faults on the port itself; these never heal by retrying
    public boolean isPortFault() {
        return PORT_FAULTS.contains(this);
    }

    public static DeviceResponseCode fromCode(int code) {
        for (DeviceResponseCode value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
