package com.chargelink.gateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * 🌟 Standardized API Response Wrapper
 *
 * @param <T> Response data type
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ApiResponse<T> {

    @Builder.Default
    private Boolean success = true;

    private T data;

    private String message;

    private ErrorDetails error;

    @Builder.Default
    private Instant timestamp = Instant.now();

    private String requestId;

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .requestId(generateRequestId())
                .build();
    }

    public static <T> ApiResponse<T> success(T data, String message) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .message(message)
                .requestId(generateRequestId())
                .build();
    }

    /**
     * Business-level failure that still carries a payload, e.g. a device refusing to start.
     */
    public static <T> ApiResponse<T> failure(T data, String message) {
        return ApiResponse.<T>builder()
                .success(false)
                .data(data)
                .message(message)
                .requestId(generateRequestId())
                .build();
    }

    public static <T> ApiResponse<T> error(ErrorDetails error) {
        return ApiResponse.<T>builder()
                .success(false)
                .message(error.getMessage())
                .error(error)
                .requestId(generateRequestId())
                .build();
    }

    private static String generateRequestId() {
        return "req_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    /**
     * 🚨 Error Details Structure
     */
    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetails {

        private String code;

        private String message;

        private String details;

        private String field;

        private String path;

        @Builder.Default
        private Instant timestamp = Instant.now();

        private String trace;
    }
}
