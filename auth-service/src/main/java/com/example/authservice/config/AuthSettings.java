package com.example.authservice.config;

import com.example.authservice.crypto.CredentialHasher;
import com.example.authservice.exception.InvalidConfigException;

import java.nio.charset.StandardCharsets;

/**
 * Process-wide auth configuration, built once at startup and injected into the
 * hasher, token codec and gates.
 *
 * Immutable; {@link #signingKey()} hands out a copy.
 */
public final class AuthSettings {

    private final byte[] signingKey;
    private final long tokenTtlSeconds;
    private final int workFactor;

    public AuthSettings(byte[] signingKey, long tokenTtlSeconds, int workFactor) {
        if (signingKey == null || signingKey.length == 0) {
            throw new InvalidConfigException("JWT secret must not be empty");
        }
        if (tokenTtlSeconds <= 0) {
            throw new InvalidConfigException("Token TTL must be positive, got " + tokenTtlSeconds);
        }
        CredentialHasher.validateWorkFactor(workFactor);
        this.signingKey = signingKey.clone();
        this.tokenTtlSeconds = tokenTtlSeconds;
        this.workFactor = workFactor;
    }

    public static AuthSettings of(String secret, long tokenTtlSeconds, int workFactor) {
        if (secret == null || secret.isBlank()) {
            throw new InvalidConfigException(
                    "JWT secret is not configured. Set environment variable JWT_SECRET or property auth.jwt.secret");
        }
        return new AuthSettings(secret.getBytes(StandardCharsets.UTF_8), tokenTtlSeconds, workFactor);
    }

    public byte[] signingKey() {
        return signingKey.clone();
    }

    public int signingKeyLength() {
        return signingKey.length;
    }

    public long tokenTtlSeconds() {
        return tokenTtlSeconds;
    }

    public int workFactor() {
        return workFactor;
    }

    @Override
    public String toString() {
        return "AuthSettings{signingKey=[REDACTED], tokenTtlSeconds=" + tokenTtlSeconds
                + ", workFactor=" + workFactor + "}";
    }
}
