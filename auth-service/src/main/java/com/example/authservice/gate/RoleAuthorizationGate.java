package com.example.authservice.gate;

import com.example.authservice.exception.ErrorCode;
import com.example.authservice.exception.InvalidConfigException;
import com.example.authservice.token.Principal;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * RBAC guard that checks the attached Principal's role against an allowed set.
 * Must run after a gate that may attach a Principal.
 *
 * Role comparison is exact and case-sensitive. The role claim of a verified token is
 * trusted as-is; it is not re-checked against {@link com.example.authservice.user.Role}.
 */
@Slf4j
public class RoleAuthorizationGate implements Gate {

    static final String AUTHENTICATION_REQUIRED_MESSAGE = "Authentication required";

    private final List<String> allowedRoles;

    public RoleAuthorizationGate(String... allowedRoles) {
        if (allowedRoles == null || allowedRoles.length == 0) {
            throw new InvalidConfigException("At least one allowed role is required");
        }
        this.allowedRoles = List.copyOf(Arrays.asList(allowedRoles));
    }

    @Override
    public GateResult apply(RequestContext context) {
        Optional<Principal> principal = context.getPrincipal();
        if (principal.isEmpty()) {
            return GateResult.terminate(GateRejection.unauthorized(
                    ErrorCode.UNAUTHORIZED, AUTHENTICATION_REQUIRED_MESSAGE, context));
        }

        String role = principal.get().role();
        if (!allowedRoles.contains(role)) {
            log.warn("Access denied: userId={} role={} required={}",
                    principal.get().subjectId(), role, allowedRoles);
            return GateResult.terminate(GateRejection.forbidden(String.format(
                    "Access denied. Required role(s): %s. Your role: %s",
                    String.join(", ", allowedRoles), role), context));
        }
        return GateResult.proceed(context);
    }

    public List<String> getAllowedRoles() {
        return allowedRoles;
    }
}
