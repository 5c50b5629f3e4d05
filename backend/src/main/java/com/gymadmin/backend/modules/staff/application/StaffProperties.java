package com.gymadmin.backend.modules.staff.application;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.staff")
public record StaffProperties(
        @DefaultValue("P90D") Duration sessionTtl,
        @DefaultValue("PT30M") Duration sessionCleanupInterval,
        @DefaultValue Pin pin
) {

    public record Pin(
            @DefaultValue("5") int maxAttempts,
            @DefaultValue("PT15M") Duration window,
            @DefaultValue("12") int bcryptStrength
    ) {
    }
}
