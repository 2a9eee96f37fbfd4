package com.example.authservice.gate;

import com.example.authservice.config.AuthSettings;
import com.example.authservice.token.TokenVerifier;

/**
 * Factory for the gates, bound to the process-wide verifier and settings.
 */
public class AuthGates {

    private final AuthenticationGate authenticationGate;
    private final OptionalAuthenticationGate optionalAuthenticationGate;

    public AuthGates(TokenVerifier tokenVerifier, AuthSettings authSettings) {
        this.authenticationGate = new AuthenticationGate(tokenVerifier, authSettings);
        this.optionalAuthenticationGate = new OptionalAuthenticationGate(tokenVerifier, authSettings);
    }

    public Gate authenticate() {
        return authenticationGate;
    }

    public Gate authenticateOptional() {
        return optionalAuthenticationGate;
    }

    public Gate requireRole(String... allowedRoles) {
        return new RoleAuthorizationGate(allowedRoles);
    }
}
