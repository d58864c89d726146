package com.chargelink.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Automatic resend of unacknowledged commands.
 *
 * @param enabled         whether resends happen at all
 * @param timeout         how long to wait for a confirmation before resending
 * @param maxRetries      resends before a command is marked failed
 * @param maxAge          entries older than this expire regardless of state
 * @param checkIntervalMs period of the resend check
 */
@ConfigurationProperties(prefix = "charge-gateway.retry")
public record CommandRetryProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("5s") Duration timeout,
    @DefaultValue("2") int maxRetries,
    @DefaultValue("60s") Duration maxAge,
    @DefaultValue("1000") long checkIntervalMs
) {

    public CommandRetryProperties {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Retry timeout must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative");
        }
        if (maxAge == null || maxAge.compareTo(timeout) < 0) {
            throw new IllegalArgumentException("Max age must be at least the retry timeout");
        }
    }
}
