package com.example.authservice.gate;

import com.example.authservice.config.AuthSettings;
import com.example.authservice.token.Principal;
import com.example.authservice.token.TokenIssuer;
import com.example.authservice.token.TokenVerifier;
import com.example.authservice.token.UserIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.time.Clock;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * State machine of the mandatory authentication gate.
 */
class AuthenticationGateTest {

    private static final String REQUEST_ID = "req-1";

    private AuthSettings settings;
    private TokenIssuer issuer;
    private AuthenticationGate gate;

    @BeforeEach
    void setUp() {
        settings = AuthSettings.of("secret", 86400, 4);
        issuer = new TokenIssuer(Clock.systemUTC());
        gate = new AuthenticationGate(new TokenVerifier(Clock.systemUTC()), settings);
    }

    @Test
    void validToken_attachesPrincipalAndContinues() {
        String token = issuer.sign(new UserIdentity(1, "a@b.com", "student"), settings.signingKey());

        GateResult result = gate.apply(RequestContext.of(REQUEST_ID, "Bearer " + token));

        assertFalse(result.isTerminated());
        RequestContext context = result.getContext().orElseThrow();
        assertEquals(new Principal(1, "a@b.com", "student"), context.getPrincipal().orElseThrow());
        assertEquals(REQUEST_ID, context.requestId());
    }

    @Test
    void missingHeader_rejectsUnauthorized() {
        GateRejection rejection = reject(null);

        assertEquals(HttpStatus.UNAUTHORIZED, rejection.status());
        assertEquals("UNAUTHORIZED", rejection.code());
        assertEquals("Missing or invalid Authorization header. Expected: Bearer <token>", rejection.message());
    }

    @Test
    void wrongScheme_rejectsUnauthorized() {
        assertEquals("UNAUTHORIZED", reject("Basic dXNlcjpwYXNz").code());
        assertEquals("UNAUTHORIZED", reject("bearer abc").code());
        assertEquals("UNAUTHORIZED", reject("Bearer").code());
    }

    @Test
    void emptyToken_rejectsNoTokenProvided() {
        GateRejection rejection = reject("Bearer ");

        assertEquals(HttpStatus.UNAUTHORIZED, rejection.status());
        assertEquals("UNAUTHORIZED", rejection.code());
        assertEquals("No token provided", rejection.message());
    }

    @Test
    void malformedForgedAndExpiredTokens_shareOneResponse() {
        String forged = issuer.sign(new UserIdentity(1, "a@b.com", "admin"), "other-key".getBytes());
        String expired = issuer.sign(new UserIdentity(1, "a@b.com", "student"), settings.signingKey(), -1);

        for (String token : new String[] {"not-a-token", forged, expired}) {
            GateRejection rejection = reject("Bearer " + token);

            assertEquals(HttpStatus.UNAUTHORIZED, rejection.status());
            assertEquals("INVALID_TOKEN", rejection.code());
            assertEquals("Invalid or expired token", rejection.message());
        }
    }

    @Test
    void unexpectedVerifierError_rejectsAuthErrorWithoutDetail() {
        TokenVerifier failing = mock(TokenVerifier.class);
        when(failing.verify(anyString(), any())).thenThrow(new IllegalStateException("db password is hunter2"));
        AuthenticationGate failingGate = new AuthenticationGate(failing, settings);

        GateResult result = failingGate.apply(RequestContext.of(REQUEST_ID, "Bearer abc.def.ghi"));

        GateRejection rejection = result.getRejection().orElseThrow();
        assertEquals("AUTH_ERROR", rejection.code());
        assertEquals("Authentication failed", rejection.message());
        assertEquals(REQUEST_ID, rejection.body().error().requestId());
    }

    @Test
    void rejectionBodyCarriesRequestIdAndTimestamp() {
        GateRejection rejection = reject(null);

        assertFalse(rejection.body().ok());
        assertEquals(REQUEST_ID, rejection.body().error().requestId());
        assertNotNull(Instant.parse(rejection.body().error().timestamp()));
    }

    private GateRejection reject(String header) {
        GateResult result = gate.apply(RequestContext.of(REQUEST_ID, header));
        assertTrue(result.isTerminated());
        return result.getRejection().orElseThrow();
    }
}
