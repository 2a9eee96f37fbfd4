package com.example.authservice.gate;

import com.example.authservice.token.Principal;

import java.util.Optional;

/**
 * Per-request state seen by the gates.
 * Immutable: attaching a principal returns a new context.
 *
 * @param requestId           id echoed in error bodies and logs
 * @param authorizationHeader raw Authorization header value, null when absent
 * @param principal           authenticated identity, null until a gate attaches one
 */
public record RequestContext(
    String requestId,
    String authorizationHeader,
    Principal principal
) {

    public static RequestContext of(String requestId, String authorizationHeader) {
        return new RequestContext(requestId, authorizationHeader, null);
    }

    public Optional<Principal> getPrincipal() {
        return Optional.ofNullable(principal);
    }

    public RequestContext withPrincipal(Principal principal) {
        return new RequestContext(requestId, authorizationHeader, principal);
    }
}
