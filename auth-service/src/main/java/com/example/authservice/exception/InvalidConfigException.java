package com.example.authservice.exception;

/**
 * Thrown when configuration values are out of range
 * (work factor outside [1,31], blank signing key, non-positive TTL).
 * Raised at startup or on reconfiguration, never during request handling.
 */
public class InvalidConfigException extends IllegalArgumentException {

    public InvalidConfigException(String message) {
        super(message);
    }
}
