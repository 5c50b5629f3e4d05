package com.gymadmin.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Sanitized outcome of an audited operation, ready to persist.
 */
public record AuditOutcome(
        String actorId,
        String actorEmail,
        String action,
        String resourceType,
        String resourceId,
        String branchId,
        String ipAddress,
        String userAgent,
        OffsetDateTime occurredAt,
        boolean success,
        int statusCode,
        String correlationId,
        Map<String, Object> requestData,
        Map<String, Object> responseData
) {
}
