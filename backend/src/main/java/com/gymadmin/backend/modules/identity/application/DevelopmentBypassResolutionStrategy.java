package com.gymadmin.backend.modules.identity.application;

import com.gymadmin.backend.modules.identity.domain.AuthenticatedPrincipal;
import com.gymadmin.backend.modules.identity.domain.IdentityResolution;
import com.gymadmin.backend.modules.identity.domain.RequestCredentials;

/**
 * Registered only when {@code app.auth.mode=DEVELOPMENT_BYPASS}. Produces a principal flagged
 * {@link AuthenticatedPrincipal#synthetic()} so it can never pass for a real account.
 */
public class DevelopmentBypassResolutionStrategy implements IdentityResolutionStrategy {

    private final AuthenticatedPrincipal principal;

    public DevelopmentBypassResolutionStrategy(String role) {
        this.principal = AuthenticatedPrincipal.developmentBypass(role);
    }

    @Override
    public String name() {
        return "development-bypass";
    }

    @Override
    public IdentityResolution resolve(RequestCredentials credentials) {
        return IdentityResolution.resolved(principal);
    }

    @Override
    public boolean synthetic() {
        return true;
    }
}
