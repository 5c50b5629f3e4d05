package com.gymadmin.backend.modules.access.presentation;

import java.util.List;

import com.gymadmin.backend.global.security.SecurityUtils;
import com.gymadmin.backend.modules.access.application.PermissionRegistry;
import com.gymadmin.backend.modules.access.domain.Permission;
import com.gymadmin.backend.modules.access.presentation.dto.PermissionSummaryResponse;
import com.gymadmin.backend.modules.identity.domain.AuthenticatedPrincipal;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class PermissionController {

    private final PermissionRegistry permissionRegistry;

    public PermissionController(PermissionRegistry permissionRegistry) {
        this.permissionRegistry = permissionRegistry;
    }

    @GetMapping("/auth/permissions")
    @Operation(summary = "Effective permissions", description = "Returns the caller's role and the permissions it grants.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Permissions resolved"),
            @ApiResponse(responseCode = "401", description = "No valid credential")
    })
    public ResponseEntity<PermissionSummaryResponse> currentPermissions() {
        AuthenticatedPrincipal principal = SecurityUtils.getCurrentPrincipal();
        List<String> permissions = permissionRegistry.permissionsFor(principal.role()).stream()
                .map(Permission::token)
                .toList();
        return ResponseEntity.ok(new PermissionSummaryResponse(
                principal.id(),
                principal.email(),
                principal.role(),
                principal.sessionKind(),
                principal.branchId(),
                principal.synthetic(),
                permissions,
                permissions.size()
        ));
    }
}
