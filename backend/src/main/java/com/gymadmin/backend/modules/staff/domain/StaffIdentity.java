package com.gymadmin.backend.modules.staff.domain;

import java.util.UUID;

import org.springframework.util.StringUtils;

/**
 * Staff member confirmed by a PIN check. Exposes no credential material.
 */
public record StaffIdentity(UUID staffId, UUID branchId, String email, String fullName, String role) {

    public static StaffIdentity of(BranchStaff staff) {
        return new StaffIdentity(staff.getId(), staff.getBranchId(), staff.getEmail(), staff.getFullName(),
                staff.getRole());
    }

    public boolean hasIdentifiableActor() {
        return staffId != null && StringUtils.hasText(email);
    }
}
