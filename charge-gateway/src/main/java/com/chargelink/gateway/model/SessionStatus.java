package com.chargelink.gateway.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of states a monitored charging session moves through.
 */
@Getter
@RequiredArgsConstructor
public enum SessionStatus {

    STARTING("starting", false),
    CHARGING("charging", false),
    CONNECTED("connected", false),
    FLOATING_CHARGE("floating_charge", false),
    CHARGING_COMPLETED("charging_completed", true),
    CHARGING_STOPPED("charging_stopped", true),
    ERROR("error", false),
    DEVICE_OFFLINE("device_offline", true),
    PORT_FAULT("port_fault", true),
    TERMINATED("terminated", true);

    private final String wireName;
    private final boolean terminal;

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
