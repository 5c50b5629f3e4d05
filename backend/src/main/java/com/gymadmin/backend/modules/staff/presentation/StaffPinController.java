package com.gymadmin.backend.modules.staff.presentation;

import java.util.UUID;

import com.gymadmin.backend.modules.access.domain.Permission;
import com.gymadmin.backend.modules.access.presentation.annotation.RequireBranchAccess;
import com.gymadmin.backend.modules.audit.presentation.annotation.Audited;
import com.gymadmin.backend.modules.staff.application.StaffPinAdministrationService;
import com.gymadmin.backend.modules.staff.presentation.dto.StaffSummaryResponse;
import com.gymadmin.backend.modules.staff.presentation.dto.UpdateStaffPinRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StaffPinController {

    private final StaffPinAdministrationService staffPinAdministrationService;

    public StaffPinController(StaffPinAdministrationService staffPinAdministrationService) {
        this.staffPinAdministrationService = staffPinAdministrationService;
    }

    @PutMapping("/branches/{branchId}/staff/{staffId}/pin")
    @RequireBranchAccess(Permission.STAFF_MANAGE_PINS)
    @Audited(action = "UPDATE_STAFF_PIN", resourceType = "staff", resourceIdVariable = "staffId")
    @Operation(summary = "Set staff PIN", description = "Stores a new PIN hash. Also migrates staff without one.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "PIN updated"),
            @ApiResponse(responseCode = "400", description = "PIN malformed or too weak"),
            @ApiResponse(responseCode = "403", description = "Missing staff:manage_pins or other branch"),
            @ApiResponse(responseCode = "404", description = "Staff member not in this branch")
    })
    public ResponseEntity<StaffSummaryResponse> updatePin(@PathVariable UUID branchId,
                                                          @PathVariable UUID staffId,
                                                          @Valid @RequestBody UpdateStaffPinRequest request) {
        return ResponseEntity.ok(staffPinAdministrationService.updatePin(branchId, staffId, request.pin()));
    }
}
