package com.example.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Request body or path parameter failed validation (HTTP 400).
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message, HttpStatus.BAD_REQUEST);
    }

    public static ValidationException invalidRole() {
        return new ValidationException("Invalid role. Must be admin, instructor, or student");
    }

    public static ValidationException invalidUserId() {
        return new ValidationException("Invalid user ID");
    }

    public static ValidationException invalidRoleData() {
        return new ValidationException("Invalid role data");
    }
}
