package com.example.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when registering with an email that is already taken.
 * Response: 409 Conflict - "Email already registered"
 */
public class EmailAlreadyExistsException extends BaseException {

    public EmailAlreadyExistsException() {
        super(ErrorCode.EMAIL_EXISTS, "Email already registered", HttpStatus.CONFLICT);
    }
}
