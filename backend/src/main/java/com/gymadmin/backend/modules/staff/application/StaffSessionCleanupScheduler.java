package com.gymadmin.backend.modules.staff.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class StaffSessionCleanupScheduler {

    private static final Logger log = LoggerFactory.getLogger(StaffSessionCleanupScheduler.class);

    private final StaffSessionService staffSessionService;

    public StaffSessionCleanupScheduler(StaffSessionService staffSessionService) {
        this.staffSessionService = staffSessionService;
    }

    @Scheduled(fixedDelayString = "${app.staff.session-cleanup-interval:PT30M}")
    public void purgeExpiredSessions() {
        int removed = staffSessionService.purgeExpiredSessions();
        if (removed > 0) {
            log.info("Removed {} expired branch sessions", removed);
        }
    }
}
