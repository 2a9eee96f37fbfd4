package com.example.authservice.token;

/**
 * Authenticated identity extracted from a verified bearer token.
 * Lives for the duration of one request.
 */
public record Principal(
    long subjectId,
    String email,
    String role
) {
}
