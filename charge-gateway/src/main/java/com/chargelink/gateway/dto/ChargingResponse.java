package com.chargelink.gateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChargingResponse {

    private boolean success;
    private String message;
    private String deviceId;
    private Integer port;
    private String orderNumber;
    private String status;
    // Raw device response code
    private Integer responseCode;
    @Builder.Default
    private Instant timestamp = Instant.now();
}
