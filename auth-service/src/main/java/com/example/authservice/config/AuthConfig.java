package com.example.authservice.config;

import com.example.authservice.crypto.CredentialHasher;
import com.example.authservice.gate.AuthGates;
import com.example.authservice.token.TokenIssuer;
import com.example.authservice.token.TokenVerifier;
import com.example.authservice.user.InMemoryUserAccountStore;
import com.example.authservice.user.UserAccountStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the auth core from configuration.
 *
 * - auth.jwt.secret: HMAC signing key (JWT_SECRET), required
 * - auth.jwt.ttl-seconds: token lifetime, default 86400
 * - auth.password.work-factor: BCrypt cost, default 12
 *
 * Values are read once into {@link AuthSettings}; no component reads them again.
 */
@Slf4j
@Configuration
public class AuthConfig {

    /**
     * HS256 keys shorter than 256 bits still work but are weak.
     */
    private static final int RECOMMENDED_KEY_LENGTH = 32;

    @Bean
    public AuthSettings authSettings(
            @Value("${auth.jwt.secret:}") String jwtSecret,
            @Value("${auth.jwt.ttl-seconds:86400}") long tokenTtlSeconds,
            @Value("${auth.password.work-factor:12}") int workFactor) {
        AuthSettings settings = AuthSettings.of(jwtSecret, tokenTtlSeconds, workFactor);
        if (settings.signingKeyLength() < RECOMMENDED_KEY_LENGTH) {
            log.warn("JWT secret length is {} bytes. Consider using at least {} bytes for HS256.",
                    settings.signingKeyLength(), RECOMMENDED_KEY_LENGTH);
        }
        log.info("Auth configuration loaded: {}", settings);
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CredentialHasher credentialHasher(AuthSettings authSettings) {
        return new CredentialHasher(authSettings.workFactor());
    }

    @Bean
    public TokenIssuer tokenIssuer(Clock clock) {
        return new TokenIssuer(clock);
    }

    @Bean
    public TokenVerifier tokenVerifier(Clock clock) {
        return new TokenVerifier(clock);
    }

    @Bean
    public AuthGates authGates(TokenVerifier tokenVerifier, AuthSettings authSettings) {
        return new AuthGates(tokenVerifier, authSettings);
    }

    @Bean
    @ConditionalOnMissingBean(UserAccountStore.class)
    public UserAccountStore userAccountStore(Clock clock) {
        log.info("No persistent user store configured, using in-memory store");
        return new InMemoryUserAccountStore(clock);
    }
}
