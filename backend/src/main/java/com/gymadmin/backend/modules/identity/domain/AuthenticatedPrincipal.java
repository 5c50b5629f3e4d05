package com.gymadmin.backend.modules.identity.domain;

import java.util.Objects;

import org.springframework.util.StringUtils;

/**
 * Identity resolved for one request. Branch-session principals always carry the branch of their session record.
 */
public record AuthenticatedPrincipal(
        String id,
        String email,
        String role,
        SessionKind sessionKind,
        String branchId,
        boolean synthetic
) {

    public static final String SYNTHETIC_ID = "development-bypass";
    public static final String SYNTHETIC_EMAIL = "development-bypass@localhost";

    public AuthenticatedPrincipal {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(role, "role is required");
        Objects.requireNonNull(sessionKind, "sessionKind is required");
        if (sessionKind == SessionKind.BRANCH_SESSION && !StringUtils.hasText(branchId)) {
            throw new IllegalArgumentException("branch session principal requires a branchId");
        }
    }

    public static AuthenticatedPrincipal branchSession(String staffId, String email, String role, String branchId) {
        return new AuthenticatedPrincipal(staffId, email, role, SessionKind.BRANCH_SESSION, branchId, false);
    }

    public static AuthenticatedPrincipal platformToken(String userId, String email, String role) {
        return new AuthenticatedPrincipal(userId, email, role, SessionKind.PLATFORM_TOKEN, null, false);
    }

    public static AuthenticatedPrincipal developmentBypass(String role) {
        return new AuthenticatedPrincipal(SYNTHETIC_ID, SYNTHETIC_EMAIL, role, SessionKind.PLATFORM_TOKEN, null, true);
    }

    public boolean isBranchScoped() {
        return sessionKind == SessionKind.BRANCH_SESSION;
    }

    public boolean hasIdentifiableActor() {
        return StringUtils.hasText(id) && StringUtils.hasText(email);
    }
}
