package com.example.authservice.token;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Signed payload of a bearer token.
 *
 * Claims:
 * - sub: user id (JSON integer)
 * - email: user email
 * - role: user role
 * - iat: issued at (unix seconds)
 * - exp: expiration (unix seconds)
 */
public record TokenClaims(
    long sub,
    String email,
    String role,
    long iat,
    long exp
) {

    public static final String SUBJECT = "sub";
    public static final String EMAIL = "email";
    public static final String ROLE = "role";
    public static final String ISSUED_AT = "iat";
    public static final String EXPIRES_AT = "exp";

    /**
     * Read claims from a decoded payload. Every field must be present with its declared type;
     * nothing is coerced (a string "1" is not a valid sub).
     *
     * @return claims, or empty if the payload does not have the required shape
     */
    public static Optional<TokenClaims> fromJson(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return Optional.empty();
        }
        JsonNode sub = payload.get(SUBJECT);
        JsonNode email = payload.get(EMAIL);
        JsonNode role = payload.get(ROLE);
        JsonNode iat = payload.get(ISSUED_AT);
        JsonNode exp = payload.get(EXPIRES_AT);

        if (!isInteger(sub) || !isText(email) || !isText(role) || !isNumber(iat) || !isNumber(exp)) {
            return Optional.empty();
        }
        return Optional.of(new TokenClaims(
                sub.asLong(), email.asText(), role.asText(), iat.asLong(), exp.asLong()));
    }

    public Principal toPrincipal() {
        return new Principal(sub, email, role);
    }

    private static boolean isInteger(JsonNode node) {
        return node != null && node.isIntegralNumber() && node.canConvertToLong();
    }

    private static boolean isNumber(JsonNode node) {
        return node != null && node.isNumber() && node.canConvertToLong();
    }

    private static boolean isText(JsonNode node) {
        return node != null && node.isTextual();
    }
}
