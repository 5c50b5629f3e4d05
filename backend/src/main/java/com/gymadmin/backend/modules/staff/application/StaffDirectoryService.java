package com.gymadmin.backend.modules.staff.application;

import java.util.List;
import java.util.UUID;

import com.gymadmin.backend.modules.staff.infrastructure.persistence.BranchStaffRepository;
import com.gymadmin.backend.modules.staff.presentation.dto.StaffSummaryResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class StaffDirectoryService {

    private final BranchStaffRepository branchStaffRepository;

    public StaffDirectoryService(BranchStaffRepository branchStaffRepository) {
        this.branchStaffRepository = branchStaffRepository;
    }

    public List<StaffSummaryResponse> listBranchStaff(UUID branchId) {
        return branchStaffRepository.findAllByBranchIdOrderByLastNameAscFirstNameAsc(branchId).stream()
                .map(StaffSummaryResponse::from)
                .toList();
    }
}
