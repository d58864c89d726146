package com.chargelink.gateway.controller;

import com.chargelink.gateway.dto.ChargingRequest;
import com.chargelink.gateway.dto.ChargingResponse;
import com.chargelink.gateway.dto.ChargingSessionDto;
import com.chargelink.gateway.exception.ChargeGatewayException;
import com.chargelink.gateway.exception.GlobalExceptionHandler;
import com.chargelink.gateway.model.SessionStatus;
import com.chargelink.gateway.service.ChargingMonitorService;
import com.chargelink.gateway.service.ChargingOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ChargingControllerTest {

    private static final String START_BODY = """
            {"deviceId":"04CEAA40","port":1,"orderNumber":"O1","balance":500,"duration":3600}
            """;

    @Mock
    private ChargingOrchestrator orchestrator;

    @Mock
    private ChargingMonitorService monitorService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ChargingController(orchestrator, monitorService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static ChargingResponse response(boolean success, String status) {
        return ChargingResponse.builder()
                .success(success)
                .message(status)
                .deviceId("04CEAA40")
                .port(1)
                .orderNumber("O1")
                .status(status)
                .responseCode(success ? 0 : 1)
                .build();
    }

    // ========== Commands ==========

    @Test
    @DisplayName("POST /start wraps the orchestrator result")
    void shouldStartCharging() throws Exception {
        when(orchestrator.start(any(ChargingRequest.class))).thenReturn(response(true, "started"));

        mockMvc.perform(post("/api/v1/charging/start").contentType(MediaType.APPLICATION_JSON).content(START_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.status").value("started"))
                .andExpect(jsonPath("$.data.orderNumber").value("O1"));
    }

    @Test
    @DisplayName("A refused start is 200 with success false")
    void shouldReportRefusedStart() throws Exception {
        when(orchestrator.start(any(ChargingRequest.class))).thenReturn(response(false, "failed"));

        mockMvc.perform(post("/api/v1/charging/start").contentType(MediaType.APPLICATION_JSON).content(START_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.data.responseCode").value(1));
    }

    @Test
    @DisplayName("Gateway errors map onto their HTTP status and error code")
    void shouldMapGatewayErrors() throws Exception {
        when(orchestrator.start(any(ChargingRequest.class))).thenThrow(ChargeGatewayException.deviceOffline("04CEAA40"));

        mockMvc.perform(post("/api/v1/charging/start").contentType(MediaType.APPLICATION_JSON).content(START_BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("DEVICE_OFFLINE"))
                .andExpect(jsonPath("$.error.path").value("/api/v1/charging/start"));
    }

    @Test
    @DisplayName("A port fault on start is a 409")
    void shouldMapDeviceFault() throws Exception {
        when(orchestrator.start(any(ChargingRequest.class)))
                .thenThrow(ChargeGatewayException.deviceFault("04CEAA40", 1, "port fault"));

        mockMvc.perform(post("/api/v1/charging/start").contentType(MediaType.APPLICATION_JSON).content(START_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("DEVICE_FAULT"))
                .andExpect(jsonPath("$.error.message").value("port fault, refund initiated"));
    }

    @Test
    @DisplayName("An invalid body is rejected before reaching the orchestrator")
    void shouldRejectInvalidBody() throws Exception {
        mockMvc.perform(post("/api/v1/charging/start").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"port\":1,\"orderNumber\":\"O1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        verify(orchestrator, never()).start(any());
    }

    @Test
    @DisplayName("A malformed body is a 400")
    void shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/api/v1/charging/stop").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("MALFORMED_REQUEST"));
    }

    @Test
    @DisplayName("GET /query uses the given timeout")
    void shouldQueryWithTimeout() throws Exception {
        when(orchestrator.queryWithTimeout("04CEAA40", 2, Duration.ofMillis(1500)))
                .thenReturn(response(true, "charging"));

        mockMvc.perform(get("/api/v1/charging/query")
                        .param("deviceId", "04CEAA40")
                        .param("port", "2")
                        .param("timeoutMs", "1500"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("charging"));
    }

    @Test
    @DisplayName("A timed out query is a 504")
    void shouldMapQueryTimeout() throws Exception {
        when(orchestrator.query("04CEAA40", 1)).thenThrow(ChargeGatewayException.responseTimeout("04CEAA40", 7, 5000));

        mockMvc.perform(get("/api/v1/charging/query").param("deviceId", "04CEAA40").param("port", "1"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.error.code").value("RESPONSE_TIMEOUT"));
    }

    @Test
    @DisplayName("Missing and mistyped query parameters are 400s")
    void shouldRejectBadQueryParameters() throws Exception {
        mockMvc.perform(get("/api/v1/charging/query").param("deviceId", "04CEAA40"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("MISSING_PARAMETER"));

        mockMvc.perform(get("/api/v1/charging/query").param("deviceId", "04CEAA40").param("port", "one"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("TYPE_MISMATCH"));

        verify(orchestrator, never()).query(anyString(), eq(1));
    }

    // ========== Sessions ==========

    @Test
    @DisplayName("GET /sessions lists monitored sessions")
    void shouldListSessions() throws Exception {
        ChargingSessionDto session = ChargingSessionDto.builder()
                .orderNumber("O1")
                .deviceId("04CEAA40")
                .port(1)
                .status(SessionStatus.CHARGING)
                .startTime(Instant.now())
                .active(true)
                .build();
        when(monitorService.getAllStatuses()).thenReturn(List.of(session));

        mockMvc.perform(get("/api/v1/charging/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].orderNumber").value("O1"))
                .andExpect(jsonPath("$.data[0].status").value("charging"));
    }

    @Test
    @DisplayName("An unknown session is a 404")
    void shouldReturnNotFoundForUnknownSession() throws Exception {
        when(monitorService.getStatus("NOPE")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/charging/sessions/NOPE"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("SESSION_NOT_FOUND"));
    }

    @Test
    @DisplayName("DELETE /sessions/{order} stops the monitor without finalizing")
    void shouldForceStopMonitor() throws Exception {
        ChargingSessionDto session = ChargingSessionDto.builder().orderNumber("O1").port(1).active(true).build();
        when(monitorService.getStatus("O1")).thenReturn(Optional.of(session));
        when(monitorService.stopMonitoring("O1", false)).thenReturn(true);

        mockMvc.perform(delete("/api/v1/charging/sessions/O1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("monitoring stopped"));

        verify(monitorService).stopMonitoring("O1", false);
    }
}
