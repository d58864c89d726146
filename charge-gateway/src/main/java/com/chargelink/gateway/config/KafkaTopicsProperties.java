package com.chargelink.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "charge-gateway.kafka.topics")
public record KafkaTopicsProperties(
        String bootstrapServers,
        String chargingEvents,
        String chargingAlerts,
        int partitions,
        short replication) {

    public KafkaTopicsProperties {
        if (bootstrapServers == null || bootstrapServers.isBlank())
            bootstrapServers = "localhost:9092";

        if (chargingEvents == null || chargingEvents.isBlank())
            chargingEvents = "charging.events";

        if (chargingAlerts == null || chargingAlerts.isBlank())
            chargingAlerts = "charging.alerts";

        if (partitions <= 0)
            partitions = 3;

        if (replication <= 0)
            replication = 1;
    }
}
