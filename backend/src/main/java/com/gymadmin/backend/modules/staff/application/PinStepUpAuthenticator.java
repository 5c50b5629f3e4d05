package com.gymadmin.backend.modules.staff.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.gymadmin.backend.global.error.ErrorCode;
import com.gymadmin.backend.global.error.ProblemException;
import com.gymadmin.backend.global.error.RetryableProblemException;
import com.gymadmin.backend.modules.staff.domain.BranchStaff;
import com.gymadmin.backend.modules.staff.domain.ClientContext;
import com.gymadmin.backend.modules.staff.domain.PinVerificationResult;
import com.gymadmin.backend.modules.staff.domain.StaffIdentity;
import com.gymadmin.backend.modules.staff.domain.StaffSecurityEvent;
import com.gymadmin.backend.modules.staff.domain.StaffSecurityEventType;
import com.gymadmin.backend.modules.staff.infrastructure.persistence.BranchStaffRepository;
import com.gymadmin.backend.modules.staff.infrastructure.persistence.StaffSecurityEventRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Re-verifies a staff PIN and enforces the rolling attempt window.
 * <p>
 * Every well-formed call appends a {@code PIN_ATTEMPT} event before the window is counted, so blocked calls are
 * still recorded. A call is locked out when the window already held {@code maxAttempts} attempts before it.
 * <p>
 * Known limitation: append and count are separate statements, so concurrent calls for the same staff member can
 * each see a count under the limit. The cap is approximate under concurrent load.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class PinStepUpAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(PinStepUpAuthenticator.class);

    private final BranchStaffRepository branchStaffRepository;
    private final StaffSecurityEventRepository securityEventRepository;
    private final PinHasher pinHasher;
    private final int maxAttempts;
    private final Duration window;
    private final Clock clock;
    private final String unknownStaffHash;

    public PinStepUpAuthenticator(
            BranchStaffRepository branchStaffRepository,
            StaffSecurityEventRepository securityEventRepository,
            PinHasher pinHasher,
            StaffProperties staffProperties,
            Clock clock
    ) {
        this.branchStaffRepository = branchStaffRepository;
        this.securityEventRepository = securityEventRepository;
        this.pinHasher = pinHasher;
        this.maxAttempts = staffProperties.pin().maxAttempts();
        this.window = staffProperties.pin().window();
        this.clock = clock;
        this.unknownStaffHash = pinHasher.hash("0000");
    }

    /**
     * @throws ProblemException {@code INVALID_PIN_FORMAT}, {@code TOO_MANY_ATTEMPTS} or {@code MIGRATION_REQUIRED}
     */
    public PinVerificationResult verify(UUID staffId, String pin, ClientContext clientContext) {
        if (!PinPolicy.isWellFormed(pin)) {
            throw new ProblemException(ErrorCode.INVALID_PIN_FORMAT, "PIN must be exactly 4 digits");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime windowStart = now.minus(window);
        append(staffId, StaffSecurityEventType.PIN_ATTEMPT, now, clientContext, null);

        long attemptsInWindow = securityEventRepository.countByStaffIdAndEventTypeAndOccurredAtGreaterThanEqual(
                staffId, StaffSecurityEventType.PIN_ATTEMPT, windowStart);
        if (attemptsInWindow > maxAttempts) {
            throw lockout(staffId, now, windowStart, clientContext);
        }

        Optional<BranchStaff> staff = branchStaffRepository.findById(staffId);
        if (staff.isEmpty()) {
            // burn a comparison so unknown ids cost the same as wrong PINs
            pinHasher.matches(pin, unknownStaffHash);
            return fail(staffId, now, clientContext, attemptsInWindow);
        }
        BranchStaff member = staff.get();
        if (member.requiresPinMigration()) {
            log.warn("PIN check for staff {} refused: PIN not migrated to a hash", staffId);
            throw new ProblemException(ErrorCode.MIGRATION_REQUIRED, "PIN must be reset before it can be used");
        }

        if (!pinHasher.matches(pin, member.getPinHash())) {
            return fail(staffId, now, clientContext, attemptsInWindow);
        }

        append(staffId, StaffSecurityEventType.PIN_SUCCESS, now, clientContext, null);
        return PinVerificationResult.valid(StaffIdentity.of(member));
    }

    /**
     * Step-up variant for protected routes: a wrong PIN becomes {@code INVALID_PIN} with the remaining attempts.
     */
    public StaffIdentity verifyOrThrow(UUID staffId, String pin, ClientContext clientContext) {
        PinVerificationResult result = verify(staffId, pin, clientContext);
        if (!result.isValid()) {
            throw new ProblemException(ErrorCode.INVALID_PIN, "Invalid PIN",
                    Map.of("attemptsRemaining", result.attemptsRemaining()));
        }
        return result.staff();
    }

    private PinVerificationResult fail(UUID staffId, OffsetDateTime now, ClientContext clientContext,
                                       long attemptsInWindow) {
        int remaining = (int) Math.max(0, maxAttempts - attemptsInWindow);
        append(staffId, StaffSecurityEventType.PIN_FAILURE, now, clientContext, "remaining=" + remaining);
        return PinVerificationResult.invalid(remaining);
    }

    private RetryableProblemException lockout(UUID staffId, OffsetDateTime now, OffsetDateTime windowStart,
                                              ClientContext clientContext) {
        OffsetDateTime earliest = securityEventRepository.findEarliestOccurredAt(
                staffId, StaffSecurityEventType.PIN_ATTEMPT, windowStart);
        OffsetDateTime lockoutUntil = (earliest != null ? earliest : now).plus(window);
        append(staffId, StaffSecurityEventType.PIN_LOCKOUT, now, clientContext, "until=" + lockoutUntil);

        long retryAfterSeconds = Math.max(1L, Duration.between(now, lockoutUntil).toSeconds());
        log.warn("PIN lockout for staff {} until {}", staffId, lockoutUntil);
        return new RetryableProblemException(
                ErrorCode.TOO_MANY_ATTEMPTS,
                "Too many PIN attempts. Try again later.",
                retryAfterSeconds,
                Map.of("lockoutUntil", lockoutUntil.toString())
        );
    }

    private void append(UUID staffId, StaffSecurityEventType type, OffsetDateTime occurredAt,
                        ClientContext clientContext, String detail) {
        ClientContext context = clientContext != null ? clientContext : ClientContext.unknown();
        securityEventRepository.save(new StaffSecurityEvent(
                staffId, type, occurredAt, context.ipAddress(), context.userAgent(), detail));
    }
}
