package com.chargelink.gateway.config;

import com.chargelink.gateway.service.ChargingMonitorService;
import com.chargelink.gateway.service.PendingCommandRegistry;
import com.chargelink.gateway.transport.ChannelManagerService;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * Application-wide beans: JSON mapper, executors, OpenAPI and health.
 */
@Configuration
@EnableScheduling
public class ApplicationConfiguration {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    // ---------------- Executors ----------------

    // Fires per-command deadlines
    @Bean(name = "commandTimeoutScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService commandTimeoutScheduler(CommandTrackerProperties tracker) {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(
                tracker.timeoutThreads(), new DefaultThreadFactory("command-timeout", true));
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    // Response callbacks and async orchestration, never the Netty threads
    @Bean(name = "callbackExecutor", destroyMethod = "shutdown")
    public ExecutorService callbackExecutor(CommandTrackerProperties tracker) {
        return Executors.newFixedThreadPool(tracker.callbackThreads(), new DefaultThreadFactory("command-callback", true));
    }

    // Shared by every charging monitor
    @Bean(name = "monitorScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService monitorScheduler(ChargingMonitorProperties monitor) {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(
                monitor.schedulerThreads(), new DefaultThreadFactory("charging-monitor", true));
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    // Runs the @Scheduled housekeeping jobs
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("housekeeping-");
        return scheduler;
    }

    // ---------------- API docs & health ----------------

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Charge Gateway API")
                .version("1.0.0")
                .description("Start, stop and monitor charging sessions on DNY charging piles"));
    }

    @Bean
    public HealthIndicator chargeGatewayHealthIndicator(PendingCommandRegistry registry,
                                                        ChargingMonitorService monitorService,
                                                        ChannelManagerService channelManager,
                                                        @Qualifier("callbackExecutor") ExecutorService callbackExecutor) {
        return () -> Health.up()
            .withDetail("pendingCommands", registry.pendingCount())
            .withDetail("activeMonitors", monitorService.activeCount())
            .withDetail("connectedDevices", channelManager.getActiveChannelCount())
            .withDetail("callbackExecutorShutdown", callbackExecutor.isShutdown())
            .withDetail("timestamp", Instant.now())
            .build();
    }
}
