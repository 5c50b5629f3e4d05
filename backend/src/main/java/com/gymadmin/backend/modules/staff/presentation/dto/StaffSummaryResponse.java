package com.gymadmin.backend.modules.staff.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.gymadmin.backend.modules.staff.domain.BranchStaff;

/**
 * Staff view without credential fields.
 */
public record StaffSummaryResponse(
        UUID id,
        UUID branchId,
        String firstName,
        String lastName,
        String role,
        boolean pinConfigured,
        OffsetDateTime lastActiveAt
) {

    public static StaffSummaryResponse from(BranchStaff staff) {
        return new StaffSummaryResponse(
                staff.getId(),
                staff.getBranchId(),
                staff.getFirstName(),
                staff.getLastName(),
                staff.getRole(),
                !staff.requiresPinMigration(),
                staff.getLastActiveAt()
        );
    }
}
