package com.chargelink.gateway.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 🚨 Charge Gateway Exception
 *
 * Single unchecked exception type for every failure the gateway reports,
 * classified by {@link ErrorCode}. Asynchronous paths complete their futures
 * with it; synchronous paths throw it.
 */
@Getter
public class ChargeGatewayException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String details;

    public ChargeGatewayException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public ChargeGatewayException(ErrorCode errorCode, String message, String details) {
        this(errorCode, message, details, null);
    }

    public ChargeGatewayException(ErrorCode errorCode, String message, String details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details;
    }

    // 🏭 Static factories

    public static ChargeGatewayException deviceOffline(String deviceId) {
        return new ChargeGatewayException(ErrorCode.DEVICE_OFFLINE,
                "Device offline: " + deviceId,
                "No active connection is registered for this device");
    }

    public static ChargeGatewayException invalidRequest(String message) {
        return new ChargeGatewayException(ErrorCode.INVALID_REQUEST, message);
    }

    public static ChargeGatewayException sendFailure(String deviceId, Throwable cause) {
        return new ChargeGatewayException(ErrorCode.SEND_FAILURE,
                "Failed to send command to device " + deviceId,
                cause != null ? cause.getMessage() : null, cause);
    }

    public static ChargeGatewayException sendFailure(String deviceId, String details) {
        return new ChargeGatewayException(ErrorCode.SEND_FAILURE,
                "Failed to send command to device " + deviceId, details);
    }

    public static ChargeGatewayException responseTimeout(String deviceId, int messageId, long timeoutMillis) {
        return new ChargeGatewayException(ErrorCode.RESPONSE_TIMEOUT,
                String.format("No response from device %s for message 0x%04X within %d ms",
                        deviceId, messageId, timeoutMillis));
    }

    public static ChargeGatewayException deviceFault(String deviceId, int port, String fault) {
        return new ChargeGatewayException(ErrorCode.DEVICE_FAULT,
                "port fault, refund initiated",
                String.format("device=%s port=%d fault=%s", deviceId, port, fault));
    }

    public static ChargeGatewayException duplicateSession(String orderNumber) {
        return new ChargeGatewayException(ErrorCode.DUPLICATE_SESSION,
                "Order is already being monitored: " + orderNumber);
    }

    public static ChargeGatewayException duplicateCommand(String key) {
        return new ChargeGatewayException(ErrorCode.DUPLICATE_COMMAND,
                "A command with the same correlation key is still pending: " + key);
    }

    public static ChargeGatewayException sessionNotFound(String orderNumber) {
        return new ChargeGatewayException(ErrorCode.SESSION_NOT_FOUND,
                "No active charging session for order: " + orderNumber);
    }

    public static ChargeGatewayException protocolError(String details) {
        return new ChargeGatewayException(ErrorCode.PROTOCOL_ERROR, "Malformed DNY frame", details);
    }

    public static ChargeGatewayException shutdown() {
        return new ChargeGatewayException(ErrorCode.SHUTDOWN, "Command tracking is shutting down");
    }

    public HttpStatus getHttpStatus() {
        return errorCode.getHttpStatus();
    }

    public String getFormattedMessage() {
        return String.format("[%s] %s - %s", errorCode, getMessage(), details != null ? details : "");
    }
}
