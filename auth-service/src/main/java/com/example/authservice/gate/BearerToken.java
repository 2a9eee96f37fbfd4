package com.example.authservice.gate;

/**
 * Reads the token out of an {@code Authorization: Bearer <token>} header value.
 * The scheme prefix is case-sensitive with a single space separator.
 */
final class BearerToken {

    static final String PREFIX = "Bearer ";

    enum Status {
        MISSING_OR_INVALID_HEADER,
        EMPTY,
        PRESENT
    }

    record Extraction(Status status, String token) {
    }

    private BearerToken() {
    }

    static Extraction extract(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(PREFIX)) {
            return new Extraction(Status.MISSING_OR_INVALID_HEADER, null);
        }
        String token = authorizationHeader.substring(PREFIX.length());
        if (token.isEmpty()) {
            return new Extraction(Status.EMPTY, null);
        }
        return new Extraction(Status.PRESENT, token);
    }
}
