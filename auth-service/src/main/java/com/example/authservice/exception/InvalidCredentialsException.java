package com.example.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when login credentials are invalid.
 * Unknown email and wrong password share this message.
 * Response: 401 Unauthorized - "Invalid email or password"
 */
public class InvalidCredentialsException extends BaseException {

    public InvalidCredentialsException() {
        super(ErrorCode.INVALID_CREDENTIALS, "Invalid email or password", HttpStatus.UNAUTHORIZED);
    }
}
