package com.gymadmin.backend.modules.staff.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Append-only PIN attempt log entry. Rows are never updated; {@code staffId} is not a foreign key so probes
 * against unknown staff ids are recorded as well.
 */
@Entity
@Table(name = "staff_security_event")
public class StaffSecurityEvent {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "staff_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID staffId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false, length = 16)
    private StaffSecurityEventType eventType;

    @Column(name = "ip_address", updatable = false, length = 64)
    private String ipAddress;

    @Column(name = "user_agent", updatable = false, length = 255)
    private String userAgent;

    @Column(name = "detail", updatable = false, length = 255)
    private String detail;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private OffsetDateTime occurredAt;

    protected StaffSecurityEvent() {
    }

    public StaffSecurityEvent(UUID staffId, StaffSecurityEventType eventType, OffsetDateTime occurredAt,
                              String ipAddress, String userAgent, String detail) {
        this.staffId = staffId;
        this.eventType = eventType;
        this.occurredAt = occurredAt;
        this.ipAddress = ipAddress;
        this.userAgent = userAgent;
        this.detail = detail;
    }

    public UUID getId() {
        return id;
    }

    public UUID getStaffId() {
        return staffId;
    }

    public StaffSecurityEventType getEventType() {
        return eventType;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getDetail() {
        return detail;
    }

    public OffsetDateTime getOccurredAt() {
        return occurredAt;
    }
}
