package com.chargelink.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

// timeoutThreads – threads firing per-command deadlines (default: 2)
// callbackThreads – threads running response callbacks off the network path (default: 4)
// sweepIntervalMs – period of the expired-command safety sweep (default: 30000)
@ConfigurationProperties(prefix = "charge-gateway.tracker")
public record CommandTrackerProperties(
    @DefaultValue("2") int timeoutThreads,
    @DefaultValue("4") int callbackThreads,
    @DefaultValue("30000") long sweepIntervalMs
) {

    public CommandTrackerProperties {
        if (timeoutThreads < 1) {
            throw new IllegalArgumentException("Timeout threads must be at least 1");
        }
        if (callbackThreads < 1) {
            throw new IllegalArgumentException("Callback threads must be at least 1");
        }
        if (sweepIntervalMs < 1) {
            throw new IllegalArgumentException("Sweep interval must be positive");
        }
    }
}
