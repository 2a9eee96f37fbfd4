package com.example.authservice.dto;

import com.example.authservice.token.Principal;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Token-only view of the caller. Fields other than ok/authenticated are null for anonymous callers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionResponse(
    boolean ok,
    boolean authenticated,
    Long userId,
    String email,
    String role
) {
    public static SessionResponse anonymous() {
        return new SessionResponse(true, false, null, null, null);
    }

    public static SessionResponse of(Principal principal) {
        return new SessionResponse(true, true, principal.subjectId(), principal.email(), principal.role());
    }
}
