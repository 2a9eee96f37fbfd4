package com.example.authservice.exception;

/**
 * Thrown when a caller passes an argument the core cannot work with
 * (empty secret, missing identity field).
 * Indicates a programming error in the caller; gates never catch it.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
