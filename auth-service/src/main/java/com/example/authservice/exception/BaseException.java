package com.example.authservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception class for all business exceptions raised by the auth endpoints.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode code;
    private final HttpStatus status;

    protected BaseException(ErrorCode code, String message, HttpStatus status) {
        super(message);
        this.code = code;
        this.status = status;
    }
}
