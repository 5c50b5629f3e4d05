package com.gymadmin.backend.modules.staff.presentation.dto;

import java.time.OffsetDateTime;

public record StaffLoginResponse(
        String sessionToken,
        OffsetDateTime expiresAt,
        StaffSummaryResponse staff
) {
}
