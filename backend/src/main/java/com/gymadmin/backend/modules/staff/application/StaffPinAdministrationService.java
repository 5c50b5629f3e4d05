package com.gymadmin.backend.modules.staff.application;

import java.util.UUID;

import com.gymadmin.backend.global.error.ErrorCode;
import com.gymadmin.backend.global.error.ProblemException;
import com.gymadmin.backend.modules.staff.domain.BranchStaff;
import com.gymadmin.backend.modules.staff.infrastructure.persistence.BranchStaffRepository;
import com.gymadmin.backend.modules.staff.presentation.dto.StaffSummaryResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Sets or resets a staff PIN. This is also how a staff member with no PIN hash is migrated.
 */
@Service
@Transactional
public class StaffPinAdministrationService {

    private static final Logger log = LoggerFactory.getLogger(StaffPinAdministrationService.class);

    private final BranchStaffRepository branchStaffRepository;
    private final PinHasher pinHasher;

    public StaffPinAdministrationService(BranchStaffRepository branchStaffRepository, PinHasher pinHasher) {
        this.branchStaffRepository = branchStaffRepository;
        this.pinHasher = pinHasher;
    }

    public StaffSummaryResponse updatePin(UUID branchId, UUID staffId, String newPin) {
        if (!PinPolicy.isWellFormed(newPin)) {
            throw new ProblemException(ErrorCode.INVALID_PIN_FORMAT, "PIN must be exactly 4 digits");
        }
        if (PinPolicy.isWeak(newPin)) {
            throw new ProblemException(ErrorCode.WEAK_PIN, "PIN is too easy to guess");
        }

        BranchStaff staff = branchStaffRepository.findByIdAndBranchId(staffId, branchId)
                .orElseThrow(() -> new ProblemException(ErrorCode.RESOURCE_NOT_FOUND, "Staff member not found"));
        boolean migrated = staff.requiresPinMigration();
        staff.setPinHash(pinHasher.hash(newPin));

        log.info("PIN {} for staff {} on branch {}", migrated ? "migrated" : "updated", staffId, branchId);
        return StaffSummaryResponse.from(staff);
    }
}
