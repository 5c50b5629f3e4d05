package com.gymadmin.backend.modules.staff.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.gymadmin.backend.modules.staff.domain.StaffSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StaffSessionRepository extends JpaRepository<StaffSession, UUID> {

    @Query("""
            select s
              from StaffSession s
              join fetch s.staff
             where s.tokenHash = :tokenHash
            """)
    Optional<StaffSession> findByTokenHashWithStaff(@Param("tokenHash") String tokenHash);

    @Modifying
    @Query("delete from StaffSession s where s.tokenHash = :tokenHash")
    int deleteByTokenHash(@Param("tokenHash") String tokenHash);

    @Modifying
    @Query("delete from StaffSession s where s.expiresAt <= :now or s.active = false")
    int deleteExpiredOrInactive(@Param("now") OffsetDateTime now);
}
