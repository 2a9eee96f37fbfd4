package com.example.authservice.exception;

/**
 * Base class for the expected outcomes of verifying an untrusted bearer token.
 * Always caught at the gate boundary and converted into a 401 response.
 */
public abstract class TokenException extends RuntimeException {

    protected TokenException(String message) {
        super(message);
    }

    protected TokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
