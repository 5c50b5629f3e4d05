package com.gymadmin.backend.modules.audit.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.gymadmin.backend.modules.audit.domain.AuditLog;
import com.gymadmin.backend.modules.audit.domain.AuditOutcome;
import com.gymadmin.backend.modules.audit.infrastructure.persistence.AuditLogRepository;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class AuditLogServiceTest {

    private static final Executor DIRECT = Runnable::run;

    @Mock
    private AuditLogRepository auditLogRepository;

    @Test
    void recordPersistsSanitizedOutcome() {
        AuditLogService service = new AuditLogService(auditLogRepository, DIRECT);

        service.record(outcome());

        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        assertThat(captor.getValue().getAction()).isEqualTo("CREATE_MEMBER");
        assertThat(captor.getValue().getUserEmail()).isEqualTo("dana.reyes@gym.test");
    }

    @Test
    void storeFailureNeverReachesCaller() {
        when(auditLogRepository.save(any(AuditLog.class)))
                .thenThrow(new DataAccessResourceFailureException("audit store down"));
        AuditLogService service = new AuditLogService(auditLogRepository, DIRECT);

        assertThatCode(() -> service.record(outcome())).doesNotThrowAnyException();
    }

    @Test
    void fullQueueDropsRecordWithoutFailing() {
        Executor saturated = task -> {
            throw new RejectedExecutionException("queue full");
        };
        AuditLogService service = new AuditLogService(auditLogRepository, saturated);

        assertThatCode(() -> service.record(outcome())).doesNotThrowAnyException();
        verify(auditLogRepository, never()).save(any());
    }

    private static AuditOutcome outcome() {
        return new AuditOutcome("staff-1", "dana.reyes@gym.test", "CREATE_MEMBER", "member", "m-1", "b-1",
                "203.0.113.7", "tablet", OffsetDateTime.parse("2025-03-01T10:00:00Z"), true, 201, "req-1",
                Map.of("method", "POST"), Map.of("success", true));
    }
}
