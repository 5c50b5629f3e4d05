package com.gymadmin.backend.modules.staff.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.gymadmin.backend.modules.staff.domain.BranchStaff;

import org.springframework.data.jpa.repository.JpaRepository;

public interface BranchStaffRepository extends JpaRepository<BranchStaff, UUID> {

    Optional<BranchStaff> findByIdAndBranchId(UUID id, UUID branchId);

    List<BranchStaff> findAllByBranchIdOrderByLastNameAscFirstNameAsc(UUID branchId);
}
