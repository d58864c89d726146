package com.chargelink.gateway.config;

import com.chargelink.gateway.protocol.Protocol;
import com.chargelink.gateway.protocol.ProtocolFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.util.List;

/**
 * Registers every protocol bean before the TCP server starts.
 */
@Slf4j
@Configuration
public class ProtocolRegistrationConfig {

    private final ProtocolFactory protocolFactory;
    private final List<Protocol> protocols;

    public ProtocolRegistrationConfig(ProtocolFactory protocolFactory, List<Protocol> protocols) {
        this.protocolFactory = protocolFactory;
        this.protocols = protocols;
    }

    @EventListener
    @Order(1)
    public void registerProtocols(ApplicationReadyEvent event) {
        log.info("🚀 Starting protocol registration...");
        protocols.forEach(protocolFactory::register);
        if (protocolFactory.getRegisteredCount() == 0) {
            log.error("❌ No protocols registered!");
        } else {
            log.info("✅ Registered protocols: {}", protocolFactory.getRegisteredProtocols());
        }
    }
}
