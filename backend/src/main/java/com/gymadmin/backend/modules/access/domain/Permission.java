package com.gymadmin.backend.modules.access.domain;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Permission {

    MEMBERS_READ("members:read"),
    MEMBERS_WRITE("members:write"),
    MEMBERS_DELETE("members:delete"),
    MEMBERS_SEARCH("members:search"),

    STAFF_READ("staff:read"),
    STAFF_WRITE("staff:write"),
    STAFF_DELETE("staff:delete"),
    STAFF_MANAGE_PINS("staff:manage_pins"),

    PACKAGES_READ("packages:read"),
    PACKAGES_WRITE("packages:write"),
    PACKAGES_DELETE("packages:delete"),
    PACKAGES_PRICING("packages:pricing"),

    BRANCHES_READ("branches:read"),
    BRANCHES_WRITE("branches:write"),
    BRANCHES_DELETE("branches:delete"),
    BRANCHES_MANAGE_ALL("branches:manage_all"),

    ANALYTICS_READ("analytics:read"),
    ANALYTICS_FINANCIAL("analytics:financial"),
    ANALYTICS_EXPORT("analytics:export"),

    SYSTEM_ADMIN("system:admin"),
    SYSTEM_AUDIT_LOGS("system:audit_logs"),
    SYSTEM_BACKUP("system:backup"),

    RENEWALS_PROCESS("renewals:process"),
    RENEWALS_READ("renewals:read"),
    PAYMENTS_READ("payments:read"),
    PAYMENTS_PROCESS("payments:process");

    private final String token;

    Permission(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    public static Optional<Permission> fromToken(String token) {
        return Arrays.stream(values())
                .filter(permission -> permission.token.equals(token))
                .findFirst();
    }
}
