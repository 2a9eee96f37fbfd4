package com.example.authservice.exception;

/**
 * Thrown when the token's exp claim is in the past.
 * Response: 401 Unauthorized - "Invalid or expired token"
 */
public class TokenExpiredException extends TokenException {

    public TokenExpiredException() {
        super("Token expired");
    }

    public TokenExpiredException(Throwable cause) {
        super("Token expired", cause);
    }
}
