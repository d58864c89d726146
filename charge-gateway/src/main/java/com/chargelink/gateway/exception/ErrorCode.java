package com.chargelink.gateway.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Error taxonomy of the charge gateway, each code bound to the HTTP status the
 * REST layer answers with.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    DEVICE_OFFLINE(HttpStatus.SERVICE_UNAVAILABLE),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    SEND_FAILURE(HttpStatus.BAD_GATEWAY),
    RESPONSE_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT),
    DEVICE_FAULT(HttpStatus.CONFLICT),
    DUPLICATE_SESSION(HttpStatus.CONFLICT),
    DUPLICATE_COMMAND(HttpStatus.CONFLICT),
    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND),
    PROTOCOL_ERROR(HttpStatus.BAD_REQUEST),
    SHUTDOWN(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus httpStatus;
}
