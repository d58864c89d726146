package com.chargelink.gateway.util;

import com.chargelink.gateway.exception.ChargeGatewayException;

/**
 * API ports are numbered from 1, the DNY protocol numbers them from 0.
 */
public final class PortMapper {

    private PortMapper() {
    }

    public static int toProtocolPort(int apiPort, int maxPorts) {
        if (!isValidApiPort(apiPort, maxPorts)) {
            throw ChargeGatewayException.invalidRequest(
                    String.format("Port %d out of range 1..%d", apiPort, maxPorts));
        }
        return apiPort - 1;
    }

    public static int toApiPort(int protocolPort) {
        return protocolPort + 1;
    }

    public static boolean isValidApiPort(int apiPort, int maxPorts) {
        return apiPort >= 1 && apiPort <= maxPorts;
    }
}
