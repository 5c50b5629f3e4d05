package com.gymadmin.backend.modules.access.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import com.gymadmin.backend.global.error.ErrorCode;
import com.gymadmin.backend.global.error.ProblemException;
import com.gymadmin.backend.modules.access.domain.BranchAccessDecision;
import com.gymadmin.backend.modules.access.domain.Permission;
import com.gymadmin.backend.modules.identity.domain.AuthenticatedPrincipal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class BranchAccessGuard {

    private static final Logger log = LoggerFactory.getLogger(BranchAccessGuard.class);

    private final PermissionRegistry permissionRegistry;

    public BranchAccessGuard(PermissionRegistry permissionRegistry) {
        this.permissionRegistry = permissionRegistry;
    }

    public BranchAccessDecision evaluate(AuthenticatedPrincipal principal, String targetBranchId) {
        Set<Permission> granted = permissionRegistry.permissionsFor(principal.role());
        if (granted.contains(Permission.SYSTEM_ADMIN) || granted.contains(Permission.BRANCHES_MANAGE_ALL)) {
            return BranchAccessDecision.ALLOWED_GLOBAL;
        }
        if (principal.isBranchScoped()) {
            return sameBranch(principal.branchId(), targetBranchId)
                    ? BranchAccessDecision.ALLOWED_SAME_BRANCH
                    : BranchAccessDecision.DENIED;
        }
        return BranchAccessDecision.DEFERRED_TO_PERMISSION_CHECK;
    }

    /**
     * @throws ProblemException {@code BRANCH_ACCESS_DENIED} with the assigned and requested branch ids
     */
    public BranchAccessDecision check(AuthenticatedPrincipal principal, String targetBranchId) {
        BranchAccessDecision decision = evaluate(principal, targetBranchId);
        if (decision.isDenied()) {
            log.warn("Branch access denied: principal {} assigned to {} requested {}",
                    principal.id(), principal.branchId(), targetBranchId);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("assignedBranch", principal.branchId());
            details.put("requestedBranch", targetBranchId);
            throw new ProblemException(ErrorCode.BRANCH_ACCESS_DENIED,
                    "You can only act on data of your assigned branch", details);
        }
        return decision;
    }

    static boolean sameBranch(String assigned, String requested) {
        if (assigned == null || requested == null) {
            return false;
        }
        try {
            return UUID.fromString(assigned.trim()).equals(UUID.fromString(requested.trim()));
        } catch (IllegalArgumentException ex) {
            return Objects.equals(assigned.trim(), requested.trim());
        }
    }
}
