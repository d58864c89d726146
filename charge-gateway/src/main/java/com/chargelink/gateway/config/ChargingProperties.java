package com.chargelink.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

//* Charge-control defaults.
// commandTimeout – how long start/stop/query wait for the device reply (default: 15s)
// maxPorts – highest API port number accepted (default: 16)
// defaultDuration – charge duration sent when a request has none, 0 = until full (default: 0)
// defaultMaxChargeDuration, defaultMaxPower, defaultRateMode, defaultQrCodeLight – payload defaults
@ConfigurationProperties(prefix = "charge-gateway.charging")
public record ChargingProperties(
    @DefaultValue("15s") Duration commandTimeout,
    @DefaultValue("16") int maxPorts,
    @DefaultValue("0") int defaultDuration,
    @DefaultValue("0") int defaultMaxChargeDuration,
    @DefaultValue("0") int defaultMaxPower,
    @DefaultValue("0") int defaultRateMode,
    @DefaultValue("0") int defaultQrCodeLight
) {

    public ChargingProperties {
        if (commandTimeout == null || commandTimeout.isNegative() || commandTimeout.isZero()) {
            throw new IllegalArgumentException("Command timeout must be positive");
        }
        if (maxPorts < 1 || maxPorts > 256) {
            throw new IllegalArgumentException("Max ports must be between 1 and 256");
        }
        if (defaultDuration < 0 || defaultDuration > 0xFFFF) {
            throw new IllegalArgumentException("Default duration must fit in 16 bits");
        }
    }

    public static ChargingProperties defaults() {
        return new ChargingProperties(Duration.ofSeconds(15), 16, 0, 0, 0, 0, 0);
    }
}
