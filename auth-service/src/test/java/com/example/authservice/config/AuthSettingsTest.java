package com.example.authservice.config;

import com.example.authservice.exception.InvalidConfigException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class AuthSettingsTest {

    @Test
    void of_buildsFromSecretString() {
        AuthSettings settings = AuthSettings.of("secret", 3600, 10);

        assertArrayEquals("secret".getBytes(StandardCharsets.UTF_8), settings.signingKey());
        assertEquals(6, settings.signingKeyLength());
        assertEquals(3600, settings.tokenTtlSeconds());
        assertEquals(10, settings.workFactor());
    }

    @Test
    void missingSecret_failsWithHint() {
        InvalidConfigException e = assertThrows(InvalidConfigException.class,
                () -> AuthSettings.of(" ", 3600, 10));
        assertTrue(e.getMessage().contains("JWT_SECRET"));
        assertThrows(InvalidConfigException.class, () -> AuthSettings.of(null, 3600, 10));
        assertThrows(InvalidConfigException.class, () -> new AuthSettings(new byte[0], 3600, 10));
    }

    @Test
    void invalidTtlOrWorkFactor_fails() {
        assertThrows(InvalidConfigException.class, () -> AuthSettings.of("secret", 0, 10));
        assertThrows(InvalidConfigException.class, () -> AuthSettings.of("secret", 3600, 0));
        assertThrows(InvalidConfigException.class, () -> AuthSettings.of("secret", 3600, 32));
    }

    @Test
    void signingKeyIsDefensivelyCopied() {
        byte[] key = "secret".getBytes(StandardCharsets.UTF_8);
        AuthSettings settings = new AuthSettings(key, 3600, 10);

        key[0] = 'X';
        settings.signingKey()[1] = 'Y';

        assertArrayEquals("secret".getBytes(StandardCharsets.UTF_8), settings.signingKey());
    }

    @Test
    void toString_redactsSecret() {
        String text = AuthSettings.of("super-secret-value", 3600, 10).toString();

        assertFalse(text.contains("super-secret-value"));
        assertTrue(text.contains("REDACTED"));
    }
}
