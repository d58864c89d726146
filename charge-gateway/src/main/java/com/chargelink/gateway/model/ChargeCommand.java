package com.chargelink.gateway.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Charge-control sub-commands carried in the payload of a DNY 0x82 frame.
 */
@Getter
@RequiredArgsConstructor
public enum ChargeCommand {

    STOP(0x00, "stop"),
    START(0x01, "start"),
    QUERY(0x03, "query");

    private final int code;
    private final String wireName;

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ChargeCommand fromName(String name) {
        if (name == null) {
            return null;
        }
        for (ChargeCommand command : values()) {
            if (command.wireName.equalsIgnoreCase(name.trim())) {
                return command;
            }
        }
        throw new IllegalArgumentException("Unknown charge command: " + name);
    }
}
