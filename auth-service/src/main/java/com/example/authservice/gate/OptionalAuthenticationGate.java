package com.example.authservice.gate;

import com.example.authservice.config.AuthSettings;
import com.example.authservice.token.TokenVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Best-effort authentication: attaches a Principal when the token verifies,
 * otherwise continues without one. Never terminates the pipeline.
 */
@Slf4j
@RequiredArgsConstructor
public class OptionalAuthenticationGate implements Gate {

    private final TokenVerifier tokenVerifier;
    private final AuthSettings authSettings;

    @Override
    public GateResult apply(RequestContext context) {
        BearerToken.Extraction extraction = BearerToken.extract(context.authorizationHeader());
        if (extraction.status() != BearerToken.Status.PRESENT) {
            return GateResult.proceed(context);
        }

        try {
            return GateResult.proceed(context.withPrincipal(
                    tokenVerifier.verify(extraction.token(), authSettings.signingKey())));
        } catch (RuntimeException e) {
            // Optional auth: continue anonymously
            log.debug("Optional authentication skipped: {}", e.getClass().getSimpleName());
            return GateResult.proceed(context);
        }
    }
}
