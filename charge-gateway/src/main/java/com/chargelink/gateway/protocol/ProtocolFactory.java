package com.chargelink.gateway.protocol;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry of the protocols the TCP server can speak.
 */
@Slf4j
@Component
public class ProtocolFactory {

    private final Map<String, Protocol> registry = new ConcurrentHashMap<>();

    public void register(Protocol protocol) {
        Assert.notNull(protocol, "Protocol cannot be null");
        String name = protocol.name().toUpperCase();
        registry.put(name, protocol);
        log.info("✅ Registered protocol: {}", name);
    }

    // Case-insensitive lookup
    public Optional<Protocol> get(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(registry.get(name.toUpperCase()));
    }

    public boolean isRegistered(String name) {
        return get(name).isPresent();
    }

    public Set<String> getRegisteredProtocols() {
        return Collections.unmodifiableSet(registry.keySet());
    }

    public int getRegisteredCount() {
        return registry.size();
    }
}
