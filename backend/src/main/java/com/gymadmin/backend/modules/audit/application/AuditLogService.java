package com.gymadmin.backend.modules.audit.application;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import com.gymadmin.backend.global.config.AsyncConfig;
import com.gymadmin.backend.modules.audit.domain.AuditLog;
import com.gymadmin.backend.modules.audit.domain.AuditOutcome;
import com.gymadmin.backend.modules.audit.infrastructure.persistence.AuditLogRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Persists audit records off the request thread. One attempt per record; failures are logged and dropped.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private final AuditLogRepository auditLogRepository;
    private final Executor auditTaskExecutor;

    public AuditLogService(AuditLogRepository auditLogRepository,
                           @Qualifier(AsyncConfig.AUDIT_TASK_EXECUTOR) Executor auditTaskExecutor) {
        this.auditLogRepository = auditLogRepository;
        this.auditTaskExecutor = auditTaskExecutor;
    }

    public void record(AuditOutcome outcome) {
        try {
            auditTaskExecutor.execute(() -> persist(outcome));
        } catch (RejectedExecutionException ex) {
            log.warn("Audit queue full, dropped {} on {} by {}", outcome.action(), outcome.resourceType(),
                    outcome.actorId());
        }
    }

    void persist(AuditOutcome outcome) {
        try {
            auditLogRepository.save(AuditLog.of(outcome));
        } catch (RuntimeException ex) {
            log.warn("Audit write failed for {} on {} by {} (correlationId={})", outcome.action(),
                    outcome.resourceType(), outcome.actorId(), outcome.correlationId(), ex);
        }
    }
}
