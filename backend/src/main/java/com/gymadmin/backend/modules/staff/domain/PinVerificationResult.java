package com.gymadmin.backend.modules.staff.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a PIN comparison that was allowed to run. Lockout, format and migration failures are raised instead.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PinVerificationResult(
        @JsonProperty("isValid") boolean isValid,
        Integer attemptsRemaining,
        StaffIdentity staff
) {

    public static PinVerificationResult valid(StaffIdentity staff) {
        return new PinVerificationResult(true, null, staff);
    }

    public static PinVerificationResult invalid(int attemptsRemaining) {
        return new PinVerificationResult(false, attemptsRemaining, null);
    }
}
