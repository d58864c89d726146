package com.chargelink.gateway.service;

import com.chargelink.gateway.config.ChargingProperties;
import com.chargelink.gateway.dto.ChargingRequest;
import com.chargelink.gateway.dto.ChargingResponse;
import com.chargelink.gateway.exception.ChargeGatewayException;
import com.chargelink.gateway.model.ChargeCommand;
import com.chargelink.gateway.model.DeviceResponse;
import com.chargelink.gateway.model.DeviceResponseCode;
import com.chargelink.gateway.model.SessionStatus;
import com.chargelink.gateway.notification.ChargingEventNotifier;
import com.chargelink.gateway.util.PortMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;

/**
 * Charging Orchestrator
 *
 * Start, stop and query entry points. Each operation validates its request,
 * sends one charge-control command and interprets the device reply, either
 * blocking on it or through a future completed off the network thread.
 */
@Slf4j
@Service
public class ChargingOrchestrator {

    public static final String STATUS_STARTED = "started";
    public static final String STATUS_STOPPED = "stopped";
    public static final String STATUS_FAILED = "failed";
    public static final String STATUS_UNKNOWN = "unknown";

    private final ChargeCommandSender commandSender;
    private final PendingCommandRegistry registry;
    private final ChargingMonitorService monitorService;
    private final ChargingEventNotifier eventNotifier;
    private final SessionStatusResolver statusResolver;
    private final ChargingProperties properties;
    private final Executor callbackExecutor;

    public ChargingOrchestrator(ChargeCommandSender commandSender,
                                PendingCommandRegistry registry,
                                ChargingMonitorService monitorService,
                                ChargingEventNotifier eventNotifier,
                                SessionStatusResolver statusResolver,
                                ChargingProperties properties,
                                @Qualifier("callbackExecutor") Executor callbackExecutor) {
        this.commandSender = commandSender;
        this.registry = registry;
        this.monitorService = monitorService;
        this.eventNotifier = eventNotifier;
        this.statusResolver = statusResolver;
        this.properties = properties;
        this.callbackExecutor = callbackExecutor;
    }

    // ==================== Synchronous operations ====================

    public ChargingResponse start(ChargingRequest request) {
        ChargingRequest start = prepare(request, ChargeCommand.START);
        PendingCommand pending = send(start, properties.commandTimeout());
        return onStart(start, registry.waitForResponse(pending));
    }

    public ChargingResponse stop(ChargingRequest request) {
        ChargingRequest stop = prepare(request, ChargeCommand.STOP);
        PendingCommand pending = send(stop, properties.commandTimeout());
        return onStop(stop, registry.waitForResponse(pending));
    }

    public ChargingResponse query(String deviceId, int port) {
        return queryWithTimeout(deviceId, port, properties.commandTimeout());
    }

    public ChargingResponse queryWithTimeout(String deviceId, int port, Duration timeout) {
        ChargingRequest query = prepare(queryRequest(deviceId, port), ChargeCommand.QUERY);
        PendingCommand pending = send(query, requirePositive(timeout));
        return onQuery(query, registry.waitForResponse(pending));
    }

    /**
     * Dispatch on the request's own command.
     */
    public ChargingResponse execute(ChargingRequest request) {
        if (request == null || request.getCommand() == null) {
            throw ChargeGatewayException.invalidRequest("command is required");
        }
        return switch (request.getCommand()) {
            case START -> start(request);
            case STOP -> stop(request);
            case QUERY -> query(request.getDeviceId(), request.getPort() == null ? 0 : request.getPort());
        };
    }

    // ==================== Asynchronous operations ====================
    // Validation, offline and send errors are thrown before a future exists.

    public CompletableFuture<ChargingResponse> startAsync(ChargingRequest request) {
        ChargingRequest start = prepare(request, ChargeCommand.START);
        PendingCommand pending = send(start, properties.commandTimeout());
        return pending.getResult().thenApplyAsync(response -> onStart(start, response), callbackExecutor);
    }

    public CompletableFuture<ChargingResponse> stopAsync(ChargingRequest request) {
        ChargingRequest stop = prepare(request, ChargeCommand.STOP);
        PendingCommand pending = send(stop, properties.commandTimeout());
        return pending.getResult().thenApplyAsync(response -> onStop(stop, response), callbackExecutor);
    }

    public CompletableFuture<ChargingResponse> queryAsync(String deviceId, int port, Duration timeout) {
        ChargingRequest query = prepare(queryRequest(deviceId, port), ChargeCommand.QUERY);
        PendingCommand pending = send(query, requirePositive(timeout));
        return pending.getResult().thenApplyAsync(response -> onQuery(query, response), callbackExecutor);
    }

    public void startAsync(ChargingRequest request, BiConsumer<ChargingResponse, Throwable> callback) {
        deliver(startAsync(request), callback);
    }

    public void stopAsync(ChargingRequest request, BiConsumer<ChargingResponse, Throwable> callback) {
        deliver(stopAsync(request), callback);
    }

    public void queryAsync(String deviceId, int port, Duration timeout,
                           BiConsumer<ChargingResponse, Throwable> callback) {
        deliver(queryAsync(deviceId, port, timeout), callback);
    }

    // ==================== Reply handling ====================

    private ChargingResponse onStart(ChargingRequest request, DeviceResponse response) {
        DeviceResponseCode code = response.getCode();
        String deviceId = request.getDeviceId();
        int port = request.getPort();
        String orderNumber = request.getOrderNumber();

        if (code.isSuccess()) {
            monitorService.startMonitoring(orderNumber, deviceId, port);
            eventNotifier.chargingStarted(deviceId, port, orderNumber, request.getBalance(), request.getDuration());
            log.info("⚡ Charging started on device {} port {} (order={})", deviceId, port, orderNumber);
            return reply(request, response, true, STATUS_STARTED, "charging started");
        }
        if (code.isPortFault()) {
            log.error("🔥 Device {} port {} refused order {}: {}", deviceId, port, orderNumber, code.getDescription());
            eventNotifier.deviceError(deviceId, "port_fault", port, code.getDescription(),
                    Map.of("orderNumber", orderNumber, "responseCode", response.getResponseCode()));
            throw ChargeGatewayException.deviceFault(deviceId, port, code.getDescription());
        }
        if (code == DeviceResponseCode.DEVICE_OFFLINE) {
            eventNotifier.deviceOffline(deviceId, "charging_start");
        }
        log.warn("⚠️ Device {} port {} refused order {}: {}", deviceId, port, orderNumber, code.getDescription());
        return reply(request, response, false, STATUS_FAILED, "start refused: " + code.getDescription());
    }

    private ChargingResponse onStop(ChargingRequest request, DeviceResponse response) {
        DeviceResponseCode code = response.getCode();
        if (!code.isSuccess()) {
            log.warn("⚠️ Device {} port {} refused stop: {}", request.getDeviceId(), request.getPort(), code.getDescription());
            return reply(request, response, false, STATUS_FAILED, "stop refused: " + code.getDescription());
        }
        if (request.getOrderNumber() != null) {
            monitorService.stopMonitoring(request.getOrderNumber(), true);
        } else {
            monitorService.stopMonitoringFor(request.getDeviceId(), request.getPort(), true);
        }
        log.info("⏹️ Charging stopped on device {} port {} (order={})",
                request.getDeviceId(), request.getPort(), request.getOrderNumber());
        return reply(request, response, true, STATUS_STOPPED, "charging stopped");
    }

    private ChargingResponse onQuery(ChargingRequest request, DeviceResponse response) {
        String status = statusResolver.resolve(response)
                .map(SessionStatus::wireName)
                .orElse(STATUS_UNKNOWN);
        ChargingResponse reply = reply(request, response, response.getCode().isSuccess(), status,
                response.getCode().getDescription());
        if (response.getOrderNumber() != null && !response.getOrderNumber().isEmpty()) {
            reply.setOrderNumber(response.getOrderNumber());
        }
        return reply;
    }

    private static ChargingResponse reply(ChargingRequest request, DeviceResponse response,
                                          boolean success, String status, String message) {
        return ChargingResponse.builder()
                .success(success)
                .message(message)
                .deviceId(request.getDeviceId())
                .port(request.getPort())
                .orderNumber(request.getOrderNumber())
                .status(status)
                .responseCode(response.getResponseCode())
                .build();
    }

    // ==================== Internals ====================

    private PendingCommand send(ChargingRequest request, Duration timeout) {
        return commandSender.sendCommand(request, commandSender.nextMessageId(), timeout, null);
    }

    private ChargingRequest prepare(ChargingRequest request, ChargeCommand command) {
        if (request == null) {
            throw ChargeGatewayException.invalidRequest("request is required");
        }
        if (request.getDeviceId() == null || request.getDeviceId().isBlank()) {
            throw ChargeGatewayException.invalidRequest("deviceId is required");
        }
        if (request.getPort() == null || !PortMapper.isValidApiPort(request.getPort(), properties.maxPorts())) {
            throw ChargeGatewayException.invalidRequest(
                    "port must be between 1 and " + properties.maxPorts() + ": " + request.getPort());
        }
        String orderNumber = request.getOrderNumber();
        if (orderNumber != null && orderNumber.length() > 16) {
            throw ChargeGatewayException.invalidRequest("orderNumber must be at most 16 characters");
        }
        if (command == ChargeCommand.START) {
            if (orderNumber == null || orderNumber.isBlank()) {
                throw ChargeGatewayException.invalidRequest("orderNumber is required to start charging");
            }
            if (request.getBalance() != null && request.getBalance() < 0) {
                throw ChargeGatewayException.invalidRequest("balance must not be negative");
            }
            if (monitorService.isMonitoring(orderNumber)) {
                throw ChargeGatewayException.duplicateSession(orderNumber);
            }
        }
        return request.toBuilder()
                .deviceId(request.getDeviceId().trim().toUpperCase())
                .command(command)
                .build();
    }

    private static ChargingRequest queryRequest(String deviceId, int port) {
        return ChargingRequest.builder().deviceId(deviceId).port(port).build();
    }

    private static Duration requirePositive(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw ChargeGatewayException.invalidRequest("timeout must be positive");
        }
        return timeout;
    }

    private static void deliver(CompletableFuture<ChargingResponse> future,
                                BiConsumer<ChargingResponse, Throwable> callback) {
        future.whenComplete((response, error) -> {
            try {
                callback.accept(response, error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error);
            } catch (RuntimeException e) {
                log.error("❌ Charging callback failed: {}", e.getMessage(), e);
            }
        });
    }
}
