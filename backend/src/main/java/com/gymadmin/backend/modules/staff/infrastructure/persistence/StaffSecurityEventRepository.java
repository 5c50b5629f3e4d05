package com.gymadmin.backend.modules.staff.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.gymadmin.backend.modules.staff.domain.StaffSecurityEvent;
import com.gymadmin.backend.modules.staff.domain.StaffSecurityEventType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StaffSecurityEventRepository extends JpaRepository<StaffSecurityEvent, UUID> {

    long countByStaffIdAndEventTypeAndOccurredAtGreaterThanEqual(
            UUID staffId,
            StaffSecurityEventType eventType,
            OffsetDateTime since
    );

    @Query("""
            select min(e.occurredAt)
              from StaffSecurityEvent e
             where e.staffId = :staffId
               and e.eventType = :eventType
               and e.occurredAt >= :since
            """)
    OffsetDateTime findEarliestOccurredAt(@Param("staffId") UUID staffId,
                                          @Param("eventType") StaffSecurityEventType eventType,
                                          @Param("since") OffsetDateTime since);
}
