package com.example.authservice.dto;

import com.example.authservice.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Standard error response format shared by the gates and the REST endpoints.
 *
 * <pre>
 * { "ok": false, "error": { "code", "message", "requestId", "timestamp" } }
 * </pre>
 */
public record ErrorResponse(
    @JsonProperty("ok")
    boolean ok,

    @JsonProperty("error")
    ErrorDetail error
) {

    public record ErrorDetail(
        String code,
        String message,
        String requestId,
        String timestamp
    ) {
    }

    public static ErrorResponse of(ErrorCode code, String message, String requestId) {
        return of(code.name(), message, requestId);
    }

    public static ErrorResponse of(String code, String message, String requestId) {
        return new ErrorResponse(false,
                new ErrorDetail(code, message, requestId, Instant.now().toString()));
    }
}
