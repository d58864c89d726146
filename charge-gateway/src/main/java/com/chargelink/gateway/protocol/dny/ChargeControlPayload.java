package com.chargelink.gateway.protocol.dny;

import com.chargelink.gateway.model.ChargeCommand;
import lombok.Builder;
import lombok.Value;

/**
 * Fields of the 30-byte charge-control (0x82) payload. {@code port} is the 0-based protocol port.
 */
@Value
@Builder
public class ChargeControlPayload {

    int rateMode;
    long balance;
    int port;
    ChargeCommand command;
    int duration;
    String orderNumber;
    int maxChargeDuration;
    int maxPower;
    int qrCodeLight;
}
