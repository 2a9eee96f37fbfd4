package com.example.authservice.token;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.exceptions.AlgorithmMismatchException;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.example.authservice.exception.TokenExpiredException;
import com.example.authservice.exception.TokenMalformedException;
import com.example.authservice.exception.TokenSignatureInvalidException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.Optional;

/**
 * Verifies bearer tokens issued by {@link TokenIssuer}.
 *
 * Checks run in order: structure, signature, expiry, claim shape.
 * A forged token that is also expired fails on the signature.
 */
@Slf4j
public class TokenVerifier {

    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public TokenVerifier(Clock clock) {
        this.clock = clock;
    }

    /**
     * Verify signature and expiry, then read the principal.
     *
     * @throws TokenMalformedException         wrong segment count, bad encoding or payload shape
     * @throws TokenSignatureInvalidException  signature does not match the key
     * @throws TokenExpiredException           exp claim is in the past
     */
    public Principal verify(String token, byte[] key) {
        if (token == null || token.isEmpty()) {
            throw new TokenMalformedException("Token is empty");
        }
        JWTVerifier verifier = ((JWTVerifier.BaseVerification) JWT.require(TokenIssuer.hmac(key))
                .ignoreIssuedAt())
                .build(clock);

        DecodedJWT decoded;
        try {
            decoded = verifier.verify(token);
        } catch (JWTDecodeException e) {
            throw new TokenMalformedException("Token could not be decoded", e);
        } catch (SignatureVerificationException | AlgorithmMismatchException e) {
            throw new TokenSignatureInvalidException(e);
        } catch (com.auth0.jwt.exceptions.TokenExpiredException e) {
            throw new TokenExpiredException(e);
        } catch (JWTVerificationException e) {
            throw new TokenMalformedException("Token claims rejected", e);
        }

        return readClaims(decoded)
                .map(TokenClaims::toPrincipal)
                .orElseThrow(() -> new TokenMalformedException("Invalid token payload structure"));
    }

    /**
     * Read the principal without checking signature or expiry.
     * For inspection only; never use the result for an authorization decision.
     *
     * @return principal, or empty for any malformed input
     */
    public Optional<Principal> decode(String token) {
        return decodeUnverified(token)
                .flatMap(this::readClaims)
                .map(TokenClaims::toPrincipal);
    }

    /**
     * Check the exp claim against the current time without verifying the signature.
     *
     * @return true if expired, false if not, empty if the token cannot be decoded or has no exp
     */
    public Optional<Boolean> isExpired(String token) {
        return decodeUnverified(token)
                .flatMap(this::readPayload)
                .map(payload -> payload.get(TokenClaims.EXPIRES_AT))
                .filter(exp -> exp.isNumber() && exp.canConvertToLong())
                .map(exp -> exp.asLong() < clock.instant().getEpochSecond());
    }

    private Optional<DecodedJWT> decodeUnverified(String token) {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(JWT.decode(token));
        } catch (JWTDecodeException e) {
            log.debug("Token decode failed: {}", e.getClass().getSimpleName());
            return Optional.empty();
        }
    }

    private Optional<TokenClaims> readClaims(DecodedJWT decoded) {
        return readPayload(decoded).flatMap(TokenClaims::fromJson);
    }

    private Optional<JsonNode> readPayload(DecodedJWT decoded) {
        try {
            byte[] json = Base64.getUrlDecoder().decode(decoded.getPayload());
            return Optional.of(objectMapper.readTree(new String(json, StandardCharsets.UTF_8)));
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Token payload unreadable: {}", e.getClass().getSimpleName());
            return Optional.empty();
        }
    }
}
