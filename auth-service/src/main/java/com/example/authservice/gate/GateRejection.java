package com.example.authservice.gate;

import com.example.authservice.dto.ErrorResponse;
import com.example.authservice.exception.ErrorCode;
import org.springframework.http.HttpStatus;

/**
 * Response written when a gate halts the pipeline.
 */
public record GateRejection(
    HttpStatus status,
    ErrorResponse body
) {

    public static GateRejection unauthorized(ErrorCode code, String message, RequestContext context) {
        return new GateRejection(HttpStatus.UNAUTHORIZED, ErrorResponse.of(code, message, context.requestId()));
    }

    public static GateRejection forbidden(String message, RequestContext context) {
        return new GateRejection(HttpStatus.FORBIDDEN,
                ErrorResponse.of(ErrorCode.FORBIDDEN, message, context.requestId()));
    }

    public String code() {
        return body.error().code();
    }

    public String message() {
        return body.error().message();
    }
}
