package com.example.authservice.gate;

import com.example.authservice.config.AuthSettings;
import com.example.authservice.exception.ErrorCode;
import com.example.authservice.exception.TokenException;
import com.example.authservice.token.Principal;
import com.example.authservice.token.TokenVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Mandatory authentication.
 *
 * Flow:
 * Authorization header → Bearer token → TokenVerifier.verify → Principal attached, or 401
 *
 * Malformed, forged and expired tokens all produce the same INVALID_TOKEN response.
 */
@Slf4j
@RequiredArgsConstructor
public class AuthenticationGate implements Gate {

    static final String MISSING_HEADER_MESSAGE =
            "Missing or invalid Authorization header. Expected: Bearer <token>";
    static final String NO_TOKEN_MESSAGE = "No token provided";
    static final String INVALID_TOKEN_MESSAGE = "Invalid or expired token";
    static final String AUTH_FAILED_MESSAGE = "Authentication failed";

    private final TokenVerifier tokenVerifier;
    private final AuthSettings authSettings;

    @Override
    public GateResult apply(RequestContext context) {
        BearerToken.Extraction extraction = BearerToken.extract(context.authorizationHeader());

        if (extraction.status() == BearerToken.Status.MISSING_OR_INVALID_HEADER) {
            return reject(ErrorCode.UNAUTHORIZED, MISSING_HEADER_MESSAGE, context);
        }
        if (extraction.status() == BearerToken.Status.EMPTY) {
            return reject(ErrorCode.UNAUTHORIZED, NO_TOKEN_MESSAGE, context);
        }

        try {
            Principal principal = tokenVerifier.verify(extraction.token(), authSettings.signingKey());
            log.debug("Authenticated userId={} role={}", principal.subjectId(), principal.role());
            return GateResult.proceed(context.withPrincipal(principal));
        } catch (TokenException e) {
            log.debug("Token rejected: {}", e.getClass().getSimpleName());
            return reject(ErrorCode.INVALID_TOKEN, INVALID_TOKEN_MESSAGE, context);
        } catch (RuntimeException e) {
            log.error("Authentication error for requestId={}", context.requestId(), e);
            return reject(ErrorCode.AUTH_ERROR, AUTH_FAILED_MESSAGE, context);
        }
    }

    private static GateResult reject(ErrorCode code, String message, RequestContext context) {
        return GateResult.terminate(GateRejection.unauthorized(code, message, context));
    }
}
