package com.chargelink.gateway.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public enum AlertType {

    MONITOR_ERROR("monitor_error"),
    MAX_TIME_REACHED("max_time_reached"),
    DEVICE_OFFLINE("device_offline"),
    PORT_ERROR("port_error"),
    CHARGING_ERROR("charging_error");

    private final String wireName;

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
