package com.gymadmin.backend.modules.staff.application;

import java.util.Map;
import java.util.UUID;

import com.gymadmin.backend.global.error.ErrorCode;
import com.gymadmin.backend.global.error.ProblemException;
import com.gymadmin.backend.modules.staff.application.StaffSessionService.IssuedStaffSession;
import com.gymadmin.backend.modules.staff.domain.BranchStaff;
import com.gymadmin.backend.modules.staff.domain.ClientContext;
import com.gymadmin.backend.modules.staff.domain.PinVerificationResult;
import com.gymadmin.backend.modules.staff.infrastructure.persistence.BranchStaffRepository;
import com.gymadmin.backend.modules.staff.presentation.dto.StaffLoginResponse;
import com.gymadmin.backend.modules.staff.presentation.dto.StaffSummaryResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * PIN login for staff terminals. Shares attempt bookkeeping with step-up checks.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class StaffAuthService {

    private final PinStepUpAuthenticator pinStepUpAuthenticator;
    private final StaffSessionService staffSessionService;
    private final BranchStaffRepository branchStaffRepository;

    public StaffAuthService(
            PinStepUpAuthenticator pinStepUpAuthenticator,
            StaffSessionService staffSessionService,
            BranchStaffRepository branchStaffRepository
    ) {
        this.pinStepUpAuthenticator = pinStepUpAuthenticator;
        this.staffSessionService = staffSessionService;
        this.branchStaffRepository = branchStaffRepository;
    }

    public StaffLoginResponse login(UUID staffId, String pin, ClientContext clientContext) {
        PinVerificationResult result = pinStepUpAuthenticator.verify(staffId, pin, clientContext);
        if (!result.isValid()) {
            throw new ProblemException(ErrorCode.INVALID_PIN, "Invalid staff id or PIN",
                    Map.of("attemptsRemaining", result.attemptsRemaining()));
        }
        BranchStaff staff = branchStaffRepository.findById(result.staff().staffId())
                .orElseThrow(() -> new ProblemException(ErrorCode.RESOURCE_NOT_FOUND, "Staff member not found"));
        IssuedStaffSession session = staffSessionService.open(staff);
        return new StaffLoginResponse(session.token(), session.expiresAt(), StaffSummaryResponse.from(staff));
    }

    public void logout(String sessionToken) {
        staffSessionService.close(sessionToken);
    }
}
