package com.gymadmin.backend.modules.staff.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.gymadmin.backend.global.error.ErrorCode;
import com.gymadmin.backend.global.error.ProblemException;
import com.gymadmin.backend.modules.staff.domain.BranchStaff;
import com.gymadmin.backend.modules.staff.infrastructure.persistence.BranchStaffRepository;
import com.gymadmin.backend.modules.staff.presentation.dto.StaffSummaryResponse;
import com.gymadmin.backend.support.TestStaffFactory;

import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

@ExtendWith(MockitoExtension.class)
class StaffPinAdministrationServiceTest {

    private static final UUID BRANCH_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID STAFF_ID = UUID.fromString("00000000-0000-0000-0000-0000000000b2");

    @Mock
    private BranchStaffRepository branchStaffRepository;

    private PinHasher pinHasher;
    private StaffPinAdministrationService service;

    @BeforeEach
    void setUp() {
        pinHasher = new PinHasher(new BCryptPasswordEncoder(4));
        service = new StaffPinAdministrationService(branchStaffRepository, pinHasher);
    }

    @Test
    void migratesStaffWithoutHash() {
        BranchStaff staff = TestStaffFactory.staff(STAFF_ID, BRANCH_ID, "associate", null);
        when(branchStaffRepository.findByIdAndBranchId(STAFF_ID, BRANCH_ID)).thenReturn(Optional.of(staff));

        StaffSummaryResponse response = service.updatePin(BRANCH_ID, STAFF_ID, "4821");

        assertThat(staff.getPinHash()).isNotNull().isNotEqualTo("4821");
        assertThat(pinHasher.matches("4821", staff.getPinHash())).isTrue();
        assertThat(response.pinConfigured()).isTrue();
    }

    @Test
    void weakPinIsRefused() {
        ProblemException ex = assertThrows(ProblemException.class,
                () -> service.updatePin(BRANCH_ID, STAFF_ID, "1111"));

        assertThat(ex.getCode()).isEqualTo(ErrorCode.WEAK_PIN.name());
        verifyNoInteractions(branchStaffRepository);
    }

    @Test
    void malformedPinIsRefused() {
        ProblemException ex = assertThrows(ProblemException.class,
                () -> service.updatePin(BRANCH_ID, STAFF_ID, "48211"));

        assertThat(ex.getCode()).isEqualTo(ErrorCode.INVALID_PIN_FORMAT.name());
    }

    @Test
    void missingPinIsAFormatError() {
        ProblemException ex = assertThrows(ProblemException.class,
                () -> service.updatePin(BRANCH_ID, STAFF_ID, null));

        assertThat(ex.getCode()).isEqualTo(ErrorCode.INVALID_PIN_FORMAT.name());
        verifyNoInteractions(branchStaffRepository);
    }

    @Test
    void staffOfAnotherBranchIsNotFound() {
        when(branchStaffRepository.findByIdAndBranchId(STAFF_ID, BRANCH_ID)).thenReturn(Optional.empty());

        ProblemException ex = assertThrows(ProblemException.class,
                () -> service.updatePin(BRANCH_ID, STAFF_ID, "4821"));

        assertThat(ex.getStatusCode().value()).isEqualTo(404);
    }
}
