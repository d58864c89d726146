package com.chargelink.gateway.controller;

import com.chargelink.gateway.dto.ApiResponse;
import com.chargelink.gateway.dto.ChargingRequest;
import com.chargelink.gateway.dto.ChargingResponse;
import com.chargelink.gateway.dto.ChargingSessionDto;
import com.chargelink.gateway.exception.ChargeGatewayException;
import com.chargelink.gateway.service.ChargingMonitorService;
import com.chargelink.gateway.service.ChargingOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

/**
 * Charging Controller
 *
 * REST entry points for starting, stopping and querying charging on a device
 * port, plus a view of the running session monitors. Calls block until the
 * device replies or the command times out.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/charging")
@Tag(name = "Charging", description = "Charging session control for DNY charging piles")
@RequiredArgsConstructor
public class ChargingController {

    private final ChargingOrchestrator orchestrator;
    private final ChargingMonitorService monitorService;

    @PostMapping("/start")
    @Operation(summary = "Start charging", description = "Send a start command and begin monitoring the order")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Device answered"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid request"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Order already running or port fault"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Device offline"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "504", description = "Device did not reply")
    })
    public ResponseEntity<ApiResponse<ChargingResponse>> start(@Valid @RequestBody ChargingRequest request) {
        log.info("⚡ Start requested for device {} port {} (order={})",
                request.getDeviceId(), request.getPort(), request.getOrderNumber());
        return toEntity(orchestrator.start(request));
    }

    @PostMapping("/stop")
    @Operation(summary = "Stop charging", description = "Send a stop command and finalize the order's monitor")
    public ResponseEntity<ApiResponse<ChargingResponse>> stop(@Valid @RequestBody ChargingRequest request) {
        log.info("⏹️ Stop requested for device {} port {} (order={})",
                request.getDeviceId(), request.getPort(), request.getOrderNumber());
        return toEntity(orchestrator.stop(request));
    }

    @GetMapping("/query")
    @Operation(summary = "Query port status", description = "Ask the device for the charging status of one port")
    public ResponseEntity<ApiResponse<ChargingResponse>> query(
            @Parameter(description = "Device id, 8 hex digits", required = true) @RequestParam @NotBlank String deviceId,
            @Parameter(description = "Port, 1-based", required = true) @RequestParam @Min(1) @Max(16) int port,
            @Parameter(description = "Reply timeout in milliseconds") @RequestParam(required = false) @Min(1) Long timeoutMs) {
        ChargingResponse response = timeoutMs == null
                ? orchestrator.query(deviceId, port)
                : orchestrator.queryWithTimeout(deviceId, port, Duration.ofMillis(timeoutMs));
        return toEntity(response);
    }

    @GetMapping("/sessions")
    @Operation(summary = "List monitored sessions")
    public ResponseEntity<ApiResponse<List<ChargingSessionDto>>> sessions() {
        List<ChargingSessionDto> sessions = monitorService.getAllStatuses();
        return ResponseEntity.ok(ApiResponse.success(sessions, sessions.size() + " active sessions"));
    }

    @GetMapping("/sessions/{orderNumber}")
    @Operation(summary = "Get one monitored session")
    public ResponseEntity<ApiResponse<ChargingSessionDto>> session(@PathVariable String orderNumber) {
        ChargingSessionDto session = monitorService.getStatus(orderNumber)
                .orElseThrow(() -> ChargeGatewayException.sessionNotFound(orderNumber));
        return ResponseEntity.ok(ApiResponse.success(session));
    }

    @DeleteMapping("/sessions/{orderNumber}")
    @Operation(summary = "Force-stop a monitor", description = "Stops polling without sending a device command")
    public ResponseEntity<ApiResponse<ChargingSessionDto>> stopMonitoring(@PathVariable String orderNumber) {
        ChargingSessionDto session = monitorService.getStatus(orderNumber)
                .orElseThrow(() -> ChargeGatewayException.sessionNotFound(orderNumber));
        if (!monitorService.stopMonitoring(orderNumber, false)) {
            throw ChargeGatewayException.sessionNotFound(orderNumber);
        }
        log.info("🛑 Monitor for order {} stopped by operator", orderNumber);
        return ResponseEntity.ok(ApiResponse.success(session, "monitoring stopped"));
    }

    private static ResponseEntity<ApiResponse<ChargingResponse>> toEntity(ChargingResponse response) {
        ApiResponse<ChargingResponse> body = response.isSuccess()
                ? ApiResponse.success(response, response.getMessage())
                : ApiResponse.failure(response, response.getMessage());
        return ResponseEntity.ok(body);
    }
}
