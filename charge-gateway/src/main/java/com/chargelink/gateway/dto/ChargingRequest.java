package com.chargelink.gateway.dto;

import com.chargelink.gateway.model.ChargeCommand;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Start / stop / query request for one device port. Ports are 1-based.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChargingRequest {

    @NotBlank(message = "deviceId is required")
    private String deviceId;

    @NotNull(message = "port is required")
    @Min(value = 1, message = "port must be at least 1")
    @Max(value = 16, message = "port must be at most 16")
    private Integer port;

    private ChargeCommand command;

    // Seconds, 0 = until full
    @Min(0)
    @Max(65535)
    private Integer duration;

    @Size(max = 16, message = "orderNumber must be at most 16 characters")
    private String orderNumber;

    // Balance in cents
    @Min(0)
    private Long balance;

    // Rate mode byte
    @Min(0)
    @Max(255)
    private Integer mode;

    // Watts, 0 = device default
    @Min(0)
    @Max(65535)
    private Integer maxPower;
}
