package com.gymadmin.backend.modules.audit.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.gymadmin.backend.modules.audit.domain.AuditLog;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    List<AuditLog> findByActionOrderByOccurredAtDesc(String action);
}
