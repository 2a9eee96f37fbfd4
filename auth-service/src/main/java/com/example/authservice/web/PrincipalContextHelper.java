package com.example.authservice.web;

import com.example.authservice.token.Principal;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;

import java.util.Optional;

/**
 * Helper to read the Principal the gates attached to the current request.
 *
 * Returns Optional so anonymous requests on optional-auth handlers are handled gracefully.
 */
public class PrincipalContextHelper {

    public Optional<Principal> getCurrentPrincipal() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            return Optional.empty();
        }
        Object principal = attributes.getAttribute(
                GateInterceptor.PRINCIPAL_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (principal instanceof Principal value) {
            return Optional.of(value);
        }
        return Optional.empty();
    }

    public Optional<Long> getCurrentUserId() {
        return getCurrentPrincipal().map(Principal::subjectId);
    }
}
