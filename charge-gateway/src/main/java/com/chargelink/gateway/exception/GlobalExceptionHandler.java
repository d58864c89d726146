package com.chargelink.gateway.exception;

import com.chargelink.gateway.dto.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.concurrent.CancellationException;

/**
 * 🛡️ Global Exception Handler
 *
 * Maps every failure onto the {@link ApiResponse} envelope.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // 🔧 Gateway errors

    @ExceptionHandler(ChargeGatewayException.class)
    public ResponseEntity<ApiResponse<Void>> handleChargeGatewayException(
            ChargeGatewayException ex,
            HttpServletRequest request) {

        if (ex.getHttpStatus().is5xxServerError()) {
            log.error("🚨 {} at {}: {}", ex.getErrorCode(), request.getRequestURI(), ex.getMessage());
        } else {
            log.warn("⚠️ {} at {}: {}", ex.getErrorCode(), request.getRequestURI(), ex.getMessage());
        }

        ApiResponse<Void> response = ApiResponse.error(
            ApiResponse.ErrorDetails.builder()
                .code(ex.getErrorCode().name())
                .message(ex.getMessage())
                .details(ex.getDetails())
                .path(request.getRequestURI())
                .build()
        );

        return ResponseEntity.status(ex.getHttpStatus()).body(response);
    }

    @ExceptionHandler(CancellationException.class)
    public ResponseEntity<ApiResponse<Void>> handleCancellation(
            CancellationException ex,
            HttpServletRequest request) {

        log.warn("🚫 Request cancelled at {}: {}", request.getRequestURI(), ex.getMessage());

        ApiResponse<Void> response = ApiResponse.error(
            ApiResponse.ErrorDetails.builder()
                .code("CANCELLED")
                .message("Command was cancelled before the device replied")
                .details(ex.getMessage())
                .path(request.getRequestURI())
                .build()
        );

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    // 🔍 Validation and Type Errors

    /**
     * 📝 Handles validation errors from @Valid annotations
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationError(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        log.warn("📝 Validation error at {}: {}", request.getRequestURI(), ex.getMessage());

        String validationMessage = ex.getBindingResult().getAllErrors().stream()
            .map(error -> error.getDefaultMessage())
            .reduce((a, b) -> a + "; " + b)
            .orElse("Validation failed");

        ApiResponse<Void> response = ApiResponse.error(
            ApiResponse.ErrorDetails.builder()
                .code("VALIDATION_ERROR")
                .message("Request validation failed")
                .details(validationMessage)
                .field(ex.getBindingResult().getFieldError() != null
                        ? ex.getBindingResult().getFieldError().getField() : null)
                .path(request.getRequestURI())
                .build()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConstraintViolation(
            ConstraintViolationException ex,
            HttpServletRequest request) {

        log.warn("📝 Constraint violation at {}: {}", request.getRequestURI(), ex.getMessage());

        ApiResponse<Void> response = ApiResponse.error(
            ApiResponse.ErrorDetails.builder()
                .code("VALIDATION_ERROR")
                .message("Request validation failed")
                .details(ex.getMessage())
                .path(request.getRequestURI())
                .build()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handleMethodValidation(
            HandlerMethodValidationException ex,
            HttpServletRequest request) {

        log.warn("📝 Parameter validation error at {}: {}", request.getRequestURI(), ex.getMessage());

        String validationMessage = ex.getAllErrors().stream()
            .map(error -> error.getDefaultMessage())
            .reduce((a, b) -> a + "; " + b)
            .orElse("Validation failed");

        ApiResponse<Void> response = ApiResponse.error(
            ApiResponse.ErrorDetails.builder()
                .code("VALIDATION_ERROR")
                .message("Request validation failed")
                .details(validationMessage)
                .path(request.getRequestURI())
                .build()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    /**
     * 🔧 Handles method argument type mismatch
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            HttpServletRequest request) {

        log.warn("🔧 Type mismatch error at {}: {}", request.getRequestURI(), ex.getMessage());

        String expectedType = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";

        ApiResponse<Void> response = ApiResponse.error(
            ApiResponse.ErrorDetails.builder()
                .code("TYPE_MISMATCH")
                .message("Invalid parameter type")
                .details(String.format("Parameter '%s' should be of type %s", ex.getName(), expectedType))
                .path(request.getRequestURI())
                .field(ex.getName())
                .build()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingParameter(
            MissingServletRequestParameterException ex,
            HttpServletRequest request) {

        log.warn("🔧 Missing parameter at {}: {}", request.getRequestURI(), ex.getParameterName());

        ApiResponse<Void> response = ApiResponse.error(
            ApiResponse.ErrorDetails.builder()
                .code("MISSING_PARAMETER")
                .message("Required parameter is missing")
                .details(ex.getMessage())
                .path(request.getRequestURI())
                .field(ex.getParameterName())
                .build()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            HttpServletRequest request) {

        log.warn("📝 Unreadable request body at {}: {}", request.getRequestURI(), ex.getMessage());

        ApiResponse<Void> response = ApiResponse.error(
            ApiResponse.ErrorDetails.builder()
                .code("MALFORMED_REQUEST")
                .message("Request body could not be parsed")
                .details(ex.getMostSpecificCause().getMessage())
                .path(request.getRequestURI())
                .build()
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    // 🚨 Generic Exception Handler

    /**
     * 🌐 Catches all other exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        log.error("🌐 Unexpected error at {}: {}", request.getRequestURI(), ex.getMessage(), ex);

        ApiResponse<Void> response = ApiResponse.error(
            ApiResponse.ErrorDetails.builder()
                .code("INTERNAL_ERROR")
                .message("An internal error occurred")
                .details("Please contact system administrator if this persists")
                .path(request.getRequestURI())
                .trace(ex.getClass().getSimpleName())
                .build()
        );

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
}
