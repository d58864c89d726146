package com.chargelink.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

//* Immutable Netty TCP server configuration.
// port – TCP port charging piles connect to (default: 7054)
// bossThreads – threads accepting new connections (default: 1)
// workerThreads – I/O threads, 0 = one per CPU (default: 0)
// businessThreads – threads running the business handler off the I/O loop (default: 4)
// backlog – pending connections queued before refusing new ones (default: 1024)
// keepAlive – TCP keep-alive on device connections (default: true)
// tcpNoDelay – disable Nagle's algorithm (default: true)
// idleTimeoutSeconds – connections silent this long are closed (default: 600)
// protocol – protocol used to build the channel pipeline (default: DNY)
@ConfigurationProperties(prefix = "charge-gateway.tcp")
public record NettyConfig(
    @DefaultValue("7054") int port,
    @DefaultValue("1") int bossThreads,
    @DefaultValue("0") int workerThreads,
    @DefaultValue("4") int businessThreads,
    @DefaultValue("1024") int backlog,
    @DefaultValue("true") boolean keepAlive,
    @DefaultValue("true") boolean tcpNoDelay,
    @DefaultValue("600") int idleTimeoutSeconds,
    @DefaultValue("DNY") String protocol
) {

    public NettyConfig {
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535");
        }
        if (bossThreads < 1) {
            throw new IllegalArgumentException("Boss threads must be at least 1");
        }
        if (workerThreads < 0) {
            throw new IllegalArgumentException("Worker threads cannot be negative");
        }
        if (businessThreads < 1) {
            throw new IllegalArgumentException("Business threads must be at least 1");
        }
        if (backlog < 1) {
            throw new IllegalArgumentException("Backlog must be at least 1");
        }
        if (idleTimeoutSeconds < 1) {
            throw new IllegalArgumentException("Idle timeout must be at least 1 second");
        }
    }

    /**
     * Get effective worker threads (0 means use available processors)
     */
    public int getEffectiveWorkerThreads() {
        return workerThreads == 0 ? Runtime.getRuntime().availableProcessors() : workerThreads;
    }
}
