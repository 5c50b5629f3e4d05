package com.gymadmin.backend.modules.staff.domain;

/**
 * Network metadata recorded alongside PIN attempts.
 */
public record ClientContext(String ipAddress, String userAgent) {

    public static ClientContext unknown() {
        return new ClientContext(null, null);
    }
}
