package com.chargelink.gateway.service;

import com.chargelink.gateway.exception.ChargeGatewayException;
import com.chargelink.gateway.model.DeviceResponse;
import com.chargelink.gateway.protocol.dny.DnyCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Routes inbound charge-control replies to the command registry. Holds no state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResponseDispatcher {

    private final DnyCodec codec;
    private final PendingCommandRegistry registry;
    private final CommandRetryManager retryManager;

    public boolean dispatch(byte[] frame) {
        DeviceResponse response;
        try {
            response = codec.parseResponseFrame(frame);
        } catch (ChargeGatewayException e) {
            log.warn("⚠️ Unparseable charge-control reply dropped: {}", e.getFormattedMessage());
            return false;
        }
        log.debug("📨 Reply from {}: messageId=0x{}, code={}, port={}, portStatus={}",
                response.getDeviceId(), Integer.toHexString(response.getMessageId()),
                response.getCode(), response.getPort(), response.getPortStatus());

        retryManager.confirm(response.getDeviceId(), response.getMessageId());
        return registry.notifyResponse(response.getDeviceId(), response.getMessageId(), response);
    }
}
