package com.gymadmin.backend.modules.access.presentation.dto;

import java.util.List;

import com.gymadmin.backend.modules.identity.domain.SessionKind;

public record PermissionSummaryResponse(
        String userId,
        String email,
        String role,
        SessionKind sessionKind,
        String branchId,
        boolean synthetic,
        List<String> permissions,
        int permissionCount
) {
}
