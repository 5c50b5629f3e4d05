package com.gymadmin.backend.support;

import com.gymadmin.backend.modules.staff.domain.BranchStaff;

import java.util.UUID;

import org.springframework.test.util.ReflectionTestUtils;

/**
 * Builds detached {@link BranchStaff} rows for unit tests.
 */
public final class TestStaffFactory {

    private TestStaffFactory() {
    }

    public static BranchStaff staff(UUID id, UUID branchId, String role, String pinHash) {
        BranchStaff staff = new BranchStaff();
        ReflectionTestUtils.setField(staff, "id", id);
        staff.setBranchId(branchId);
        staff.setFirstName("Dana");
        staff.setLastName("Reyes");
        staff.setEmail("dana.reyes@gym.test");
        staff.setRole(role);
        staff.setPinHash(pinHash);
        return staff;
    }
}
