package com.gymadmin.backend.global.security;

import java.util.Optional;

import com.gymadmin.backend.global.error.ErrorCode;
import com.gymadmin.backend.global.error.ProblemException;
import com.gymadmin.backend.modules.identity.domain.AuthenticatedPrincipal;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<AuthenticatedPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof AuthenticatedPrincipal principal)) {
            return Optional.empty();
        }
        return Optional.of(principal);
    }

    public static AuthenticatedPrincipal getCurrentPrincipal() {
        return findCurrentPrincipal()
                .orElseThrow(() -> new ProblemException(ErrorCode.UNAUTHENTICATED, "Authentication required"));
    }
}
