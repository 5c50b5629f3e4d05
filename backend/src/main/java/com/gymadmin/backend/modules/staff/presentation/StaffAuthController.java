package com.gymadmin.backend.modules.staff.presentation;

import java.util.List;
import java.util.UUID;

import com.gymadmin.backend.global.security.IdentityResolutionFilter;
import com.gymadmin.backend.modules.staff.application.PinStepUpAuthenticator;
import com.gymadmin.backend.modules.staff.application.StaffAuthService;
import com.gymadmin.backend.modules.staff.application.StaffDirectoryService;
import com.gymadmin.backend.modules.staff.domain.PinVerificationResult;
import com.gymadmin.backend.modules.staff.presentation.dto.StaffLoginResponse;
import com.gymadmin.backend.modules.staff.presentation.dto.StaffPinRequest;
import com.gymadmin.backend.modules.staff.presentation.dto.StaffSummaryResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/staff")
public class StaffAuthController {

    private final StaffAuthService staffAuthService;
    private final PinStepUpAuthenticator pinStepUpAuthenticator;
    private final StaffDirectoryService staffDirectoryService;

    public StaffAuthController(
            StaffAuthService staffAuthService,
            PinStepUpAuthenticator pinStepUpAuthenticator,
            StaffDirectoryService staffDirectoryService
    ) {
        this.staffAuthService = staffAuthService;
        this.pinStepUpAuthenticator = pinStepUpAuthenticator;
        this.staffDirectoryService = staffDirectoryService;
    }

    @PostMapping("/login")
    @Operation(summary = "Staff PIN login", description = "Verifies a staff PIN and opens a branch session.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session issued"),
            @ApiResponse(responseCode = "400", description = "PIN is not 4 digits"),
            @ApiResponse(responseCode = "401", description = "Wrong staff id or PIN"),
            @ApiResponse(responseCode = "409", description = "PIN must be migrated first"),
            @ApiResponse(responseCode = "429", description = "Locked out")
    })
    public ResponseEntity<StaffLoginResponse> login(@Valid @RequestBody StaffPinRequest request,
                                                    HttpServletRequest servletRequest) {
        return ResponseEntity.ok(staffAuthService.login(
                request.staffId(), request.pin(), ClientContexts.from(servletRequest)));
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(
            @RequestHeader(name = IdentityResolutionFilter.SESSION_TOKEN_HEADER, required = false) String sessionToken) {
        staffAuthService.logout(sessionToken);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/verify-pin")
    @Operation(summary = "Verify staff PIN", description = "Checks a PIN without opening a session.")
    public ResponseEntity<PinVerificationResult> verifyPin(@Valid @RequestBody StaffPinRequest request,
                                                           HttpServletRequest servletRequest) {
        return ResponseEntity.ok(pinStepUpAuthenticator.verify(
                request.staffId(), request.pin(), ClientContexts.from(servletRequest)));
    }

    @GetMapping("/branch/{branchId}")
    @Operation(summary = "Branch staff directory", description = "Lists staff of a branch for the PIN login picker.")
    public ResponseEntity<List<StaffSummaryResponse>> branchStaff(@PathVariable UUID branchId) {
        return ResponseEntity.ok(staffDirectoryService.listBranchStaff(branchId));
    }
}
