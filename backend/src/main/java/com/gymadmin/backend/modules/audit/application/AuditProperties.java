package com.gymadmin.backend.modules.audit.application;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.audit")
public record AuditProperties(@DefaultValue Executor executor) {

    public record Executor(
            @DefaultValue("2") int coreSize,
            @DefaultValue("4") int maxSize,
            @DefaultValue("500") int queueCapacity
    ) {
    }
}
