package com.gymadmin.backend.modules.staff.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record StaffPinRequest(
        @NotNull(message = "staffId is required") UUID staffId,
        String pin
) {

    @Override
    public String toString() {
        return "StaffPinRequest[staffId=" + staffId + "]";
    }
}
