package com.gymadmin.backend.modules.staff.presentation.dto;

public record UpdateStaffPinRequest(String pin) {

    @Override
    public String toString() {
        return "UpdateStaffPinRequest[pin=****]";
    }
}
