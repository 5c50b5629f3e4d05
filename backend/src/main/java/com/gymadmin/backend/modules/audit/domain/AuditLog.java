package com.gymadmin.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * One executed, permitted operation. Written once and never updated.
 */
@Entity
@Immutable
@Table(name = "audit_log")
public class AuditLog {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "user_email", nullable = false, length = 320)
    private String userEmail;

    @Column(name = "action", nullable = false, length = 64)
    private String action;

    @Column(name = "resource_type", nullable = false, length = 64)
    private String resourceType;

    @Column(name = "resource_id", length = 128)
    private String resourceId;

    @Column(name = "branch_id", length = 64)
    private String branchId;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "user_agent", length = 255)
    private String userAgent;

    @Column(name = "occurred_at", nullable = false)
    private OffsetDateTime occurredAt;

    @Column(name = "success", nullable = false)
    private boolean success;

    @Column(name = "status_code", nullable = false)
    private int statusCode;

    @Column(name = "correlation_id", length = 64)
    private String correlationId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "request_data", columnDefinition = "jsonb")
    private Map<String, Object> requestData;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "response_data", columnDefinition = "jsonb")
    private Map<String, Object> responseData;

    protected AuditLog() {
    }

    public static AuditLog of(AuditOutcome outcome) {
        AuditLog auditLog = new AuditLog();
        auditLog.userId = outcome.actorId();
        auditLog.userEmail = outcome.actorEmail();
        auditLog.action = outcome.action();
        auditLog.resourceType = outcome.resourceType();
        auditLog.resourceId = outcome.resourceId();
        auditLog.branchId = outcome.branchId();
        auditLog.ipAddress = outcome.ipAddress();
        auditLog.userAgent = outcome.userAgent();
        auditLog.occurredAt = outcome.occurredAt();
        auditLog.success = outcome.success();
        auditLog.statusCode = outcome.statusCode();
        auditLog.correlationId = outcome.correlationId();
        auditLog.requestData = outcome.requestData();
        auditLog.responseData = outcome.responseData();
        return auditLog;
    }

    public UUID getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public String getUserEmail() {
        return userEmail;
    }

    public String getAction() {
        return action;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }

    public String getBranchId() {
        return branchId;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public OffsetDateTime getOccurredAt() {
        return occurredAt;
    }

    public boolean isSuccess() {
        return success;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Map<String, Object> getRequestData() {
        return requestData;
    }

    public Map<String, Object> getResponseData() {
        return responseData;
    }
}
