package com.chargelink.gateway.dto;

import com.chargelink.gateway.model.SessionStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of a monitored charging session.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChargingSessionDto {

    String orderNumber;
    String deviceId;
    int port;
    SessionStatus status;
    Instant startTime;
    Instant lastCheckTime;
    Duration duration;
    int checkCount;
    int errorCount;
    boolean active;
    String terminationReason;
}
