package com.gymadmin.backend.modules.staff.domain;

public enum StaffSecurityEventType {
    PIN_ATTEMPT,
    PIN_SUCCESS,
    PIN_FAILURE,
    PIN_LOCKOUT
}
