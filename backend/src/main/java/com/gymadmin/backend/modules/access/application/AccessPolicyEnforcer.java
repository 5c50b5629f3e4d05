package com.gymadmin.backend.modules.access.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.gymadmin.backend.global.error.ErrorCode;
import com.gymadmin.backend.global.error.ProblemException;
import com.gymadmin.backend.modules.access.domain.Permission;
import com.gymadmin.backend.modules.identity.domain.AuthenticatedPrincipal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Applies route access rules in a fixed order: branch isolation, branch-access permissions, then the route's own
 * permission requirements.
 */
@Component
public class AccessPolicyEnforcer {

    private static final Logger log = LoggerFactory.getLogger(AccessPolicyEnforcer.class);

    private final PermissionRegistry permissionRegistry;
    private final BranchAccessGuard branchAccessGuard;

    public AccessPolicyEnforcer(PermissionRegistry permissionRegistry, BranchAccessGuard branchAccessGuard) {
        this.permissionRegistry = permissionRegistry;
        this.branchAccessGuard = branchAccessGuard;
    }

    public void requireBranchAccess(AuthenticatedPrincipal principal, String branchId, List<Permission> permissions) {
        if (!StringUtils.hasText(branchId)) {
            throw new ProblemException(ErrorCode.BRANCH_ID_REQUIRED, "Branch id is required for this operation");
        }
        branchAccessGuard.check(principal, branchId);
        for (Permission permission : permissions) {
            requirePermission(principal, permission);
        }
    }

    public void requirePermission(AuthenticatedPrincipal principal, Permission permission) {
        Set<Permission> granted = permissionRegistry.permissionsFor(principal.role());
        if (!permissionRegistry.has(granted, permission)) {
            throw denied(principal, permission.token(), "This operation requires the " + permission.token()
                    + " permission");
        }
    }

    public void requireAnyPermission(AuthenticatedPrincipal principal, List<Permission> permissions) {
        Set<Permission> granted = permissionRegistry.permissionsFor(principal.role());
        if (!permissionRegistry.hasAny(granted, permissions)) {
            List<String> tokens = permissions.stream().map(Permission::token).toList();
            throw denied(principal, tokens, "This operation requires one of " + String.join(", ", tokens));
        }
    }

    private ProblemException denied(AuthenticatedPrincipal principal, Object required, String detail) {
        log.info("Permission denied for principal {} with role {}: requires {}", principal.id(), principal.role(),
                required);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("required", required);
        details.put("userRole", principal.role());
        return new ProblemException(ErrorCode.PERMISSION_DENIED, detail, details);
    }
}
