package com.example.authservice.exception;

/**
 * Token signature does not match the signing key.
 */
public class TokenSignatureInvalidException extends TokenException {

    public TokenSignatureInvalidException() {
        super("Token signature invalid");
    }

    public TokenSignatureInvalidException(Throwable cause) {
        super("Token signature invalid", cause);
    }
}
