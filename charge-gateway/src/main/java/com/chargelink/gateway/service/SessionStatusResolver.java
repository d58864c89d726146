package com.chargelink.gateway.service;

import com.chargelink.gateway.config.ChargingMonitorProperties;
import com.chargelink.gateway.model.DeviceResponse;
import com.chargelink.gateway.model.DeviceResponseCode;
import com.chargelink.gateway.model.SessionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Classifies a status-query reply into a {@link SessionStatus}.
 * The port-status byte mapping comes from configuration.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionStatusResolver {

    private final ChargingMonitorProperties properties;

    /**
     * @return empty when the device reported a port status with no configured meaning
     */
    public Optional<SessionStatus> resolve(DeviceResponse response) {
        DeviceResponseCode code = response.getCode();
        if (code == DeviceResponseCode.DEVICE_OFFLINE) {
            return Optional.of(SessionStatus.DEVICE_OFFLINE);
        }
        if (code.isPortFault()) {
            return Optional.of(SessionStatus.PORT_FAULT);
        }
        if (response.getPortStatus() != null) {
            SessionStatus mapped = properties.portStatusMapping().get(response.getPortStatus());
            if (mapped == null) {
                log.debug("Unmapped port status {} from device {}", response.getPortStatus(), response.getDeviceId());
            }
            return Optional.ofNullable(mapped);
        }
        return Optional.of(code.isSuccess() ? SessionStatus.CHARGING : SessionStatus.ERROR);
    }
}
