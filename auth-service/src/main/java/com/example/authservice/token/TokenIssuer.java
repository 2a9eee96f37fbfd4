package com.example.authservice.token;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.example.authservice.exception.InvalidConfigException;
import com.example.authservice.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;

/**
 * Issues HS256 bearer tokens.
 *
 * Header: {"alg":"HS256","typ":"JWT"}
 * Payload: exactly sub, email, role, iat, exp (see {@link TokenClaims})
 * Signature: HMAC-SHA256 over header + "." + payload, keyed by the shared secret
 */
@Slf4j
public class TokenIssuer {

    public static final long DEFAULT_TTL_SECONDS = 86400;

    private final Clock clock;

    public TokenIssuer(Clock clock) {
        this.clock = clock;
    }

    public String sign(UserIdentity identity, byte[] key) {
        return sign(identity, key, DEFAULT_TTL_SECONDS);
    }

    /**
     * Sign a token for the given identity.
     *
     * @param identity   user the token is issued for
     * @param key        HMAC signing key
     * @param ttlSeconds lifetime; exp = iat + ttlSeconds
     * @return compact token string
     */
    public String sign(UserIdentity identity, byte[] key, long ttlSeconds) {
        if (identity == null || identity.email() == null || identity.role() == null) {
            throw new InvalidInputException("Token identity requires id, email and role");
        }
        Algorithm algorithm = hmac(key);

        Instant issuedAt = Instant.ofEpochSecond(clock.instant().getEpochSecond());
        Instant expiresAt = issuedAt.plusSeconds(ttlSeconds);

        String token = JWT.create()
                .withClaim(TokenClaims.SUBJECT, identity.id())     // sub: numeric user id
                .withClaim(TokenClaims.EMAIL, identity.email())
                .withClaim(TokenClaims.ROLE, identity.role())
                .withIssuedAt(issuedAt)
                .withExpiresAt(expiresAt)
                .sign(algorithm);

        log.debug("Issued token for userId={} role={} exp={}", identity.id(), identity.role(), expiresAt);
        return token;
    }

    static Algorithm hmac(byte[] key) {
        if (key == null || key.length == 0) {
            throw new InvalidConfigException("Signing key must not be empty");
        }
        return Algorithm.HMAC256(key);
    }
}
