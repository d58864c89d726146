package com.chargelink.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Charge gateway: TCP front end for DNY charging piles plus the charging-session REST API.
 */
@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
public class ChargeGatewayApplication {

    public static void main(String[] args) {
        log.info("🚀 Starting Charge Gateway (Java {})", System.getProperty("java.version"));
        SpringApplication.run(ChargeGatewayApplication.class, args);
    }
}
