package com.example.authservice.exception;

/**
 * Token has the wrong segment count, cannot be decoded,
 * or its payload does not carry the required claims with the required types.
 */
public class TokenMalformedException extends TokenException {

    public TokenMalformedException(String message) {
        super(message);
    }

    public TokenMalformedException(String message, Throwable cause) {
        super(message, cause);
    }
}
