package com.gymadmin.backend.modules.staff.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.gymadmin.backend.modules.staff.domain.BranchStaff;
import com.gymadmin.backend.modules.staff.domain.StaffSession;
import com.gymadmin.backend.modules.staff.infrastructure.persistence.StaffSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class StaffSessionService {

    private static final Logger log = LoggerFactory.getLogger(StaffSessionService.class);

    private final StaffSessionRepository staffSessionRepository;
    private final SessionTokenGenerator tokenGenerator;
    private final StaffProperties staffProperties;
    private final Clock clock;

    public StaffSessionService(
            StaffSessionRepository staffSessionRepository,
            SessionTokenGenerator tokenGenerator,
            StaffProperties staffProperties,
            Clock clock
    ) {
        this.staffSessionRepository = staffSessionRepository;
        this.tokenGenerator = tokenGenerator;
        this.staffProperties = staffProperties;
        this.clock = clock;
    }

    /**
     * Opens a session bound to the staff member's own branch.
     */
    public IssuedStaffSession open(BranchStaff staff) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String token = tokenGenerator.newToken();

        StaffSession session = new StaffSession();
        session.setStaff(staff);
        session.setBranchId(staff.getBranchId());
        session.setTokenHash(tokenGenerator.digest(token));
        session.setIssuedAt(now);
        session.setExpiresAt(now.plus(staffProperties.sessionTtl()));
        session.setActive(true);
        staffSessionRepository.save(session);

        log.info("Opened branch session for staff {} on branch {}", staff.getId(), staff.getBranchId());
        return new IssuedStaffSession(token, session.getExpiresAt(), staff.getId(), staff.getBranchId());
    }

    /**
     * Looks up a usable session and refreshes the staff member's last-seen time. Expired or deactivated sessions
     * are deleted on sight.
     */
    public Optional<ActiveStaffSession> resolveSession(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        String tokenHash = tokenGenerator.digest(token);
        Optional<StaffSession> found = staffSessionRepository.findByTokenHashWithStaff(tokenHash);
        if (found.isEmpty()) {
            return Optional.empty();
        }

        StaffSession session = found.get();
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!session.isUsableAt(now)) {
            staffSessionRepository.deleteByTokenHash(tokenHash);
            log.debug("Removed unusable branch session {}", session.getId());
            return Optional.empty();
        }

        BranchStaff staff = session.getStaff();
        staff.setLastActiveAt(now);
        return Optional.of(new ActiveStaffSession(
                staff.getId(),
                staff.getEmail(),
                staff.getRole(),
                session.getBranchId()
        ));
    }

    /**
     * @return {@code true} if a session was removed; an unknown token is not an error
     */
    public boolean close(String token) {
        if (!StringUtils.hasText(token)) {
            return false;
        }
        return staffSessionRepository.deleteByTokenHash(tokenGenerator.digest(token)) > 0;
    }

    public int purgeExpiredSessions() {
        return staffSessionRepository.deleteExpiredOrInactive(OffsetDateTime.now(clock));
    }

    public record IssuedStaffSession(String token, OffsetDateTime expiresAt, UUID staffId, UUID branchId) {
    }

    public record ActiveStaffSession(UUID staffId, String email, String role, UUID branchId) {
    }
}
