package com.example.authservice.exception;

/**
 * Error codes written in the {@code error.code} field of every error body.
 */
public enum ErrorCode {

    // Gate codes
    UNAUTHORIZED,
    INVALID_TOKEN,
    FORBIDDEN,
    AUTH_ERROR,

    // Endpoint codes
    VALIDATION_ERROR,
    EMAIL_EXISTS,
    INVALID_CREDENTIALS,
    USER_NOT_FOUND,
    INTERNAL_ERROR
}
