package com.chargelink.gateway.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertLevel {

    INFO,
    WARNING,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
