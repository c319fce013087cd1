package com.example.schoolidentity.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Helper class to extract the current principal from SecurityContext.
 * Returns Optional so anonymous requests and background threads are handled the same way.
 */
@Component
public class SecurityContextHelper {

    public Optional<ResolvedPrincipal> getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }

        if (authentication.getPrincipal() instanceof ResolvedPrincipal principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }
}
