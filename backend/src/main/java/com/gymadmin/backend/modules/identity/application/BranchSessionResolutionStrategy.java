package com.gymadmin.backend.modules.identity.application;

import java.util.Optional;

import com.gymadmin.backend.modules.identity.domain.AuthenticatedPrincipal;
import com.gymadmin.backend.modules.identity.domain.IdentityResolution;
import com.gymadmin.backend.modules.identity.domain.RequestCredentials;
import com.gymadmin.backend.modules.staff.application.StaffSessionService;
import com.gymadmin.backend.modules.staff.application.StaffSessionService.ActiveStaffSession;

import org.springframework.stereotype.Component;

/**
 * Resolves the {@code X-Session-Token} issued by staff PIN login. The principal's branch always comes from the
 * session record.
 */
@Component
public class BranchSessionResolutionStrategy implements IdentityResolutionStrategy {

    private final StaffSessionService staffSessionService;

    public BranchSessionResolutionStrategy(StaffSessionService staffSessionService) {
        this.staffSessionService = staffSessionService;
    }

    @Override
    public String name() {
        return "branch-session";
    }

    @Override
    public IdentityResolution resolve(RequestCredentials credentials) {
        if (!credentials.hasSessionToken()) {
            return IdentityResolution.notApplicable();
        }
        Optional<ActiveStaffSession> session = staffSessionService.resolveSession(credentials.sessionToken());
        if (session.isEmpty()) {
            return IdentityResolution.failed("session token unknown, inactive or expired");
        }
        ActiveStaffSession active = session.get();
        return IdentityResolution.resolved(AuthenticatedPrincipal.branchSession(
                active.staffId().toString(),
                active.email(),
                active.role(),
                active.branchId().toString()
        ));
    }
}
