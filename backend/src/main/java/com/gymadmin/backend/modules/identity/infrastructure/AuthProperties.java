package com.gymadmin.backend.modules.identity.infrastructure;

import java.util.List;

import com.gymadmin.backend.modules.identity.domain.AuthMode;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Authentication settings bound once at startup from {@code app.auth.*}.
 */
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(
        @DefaultValue("STRICT") AuthMode mode,
        @DefaultValue("manager") String bypassRole,
        @DefaultValue Platform platform,
        @DefaultValue({"/staff/login", "/staff/verify-pin", "/staff/branch/**"}) List<String> publicPaths
) {

    public boolean isDevelopmentBypass() {
        return mode == AuthMode.DEVELOPMENT_BYPASS;
    }

    public record Platform(
            String jwtSecret,
            @DefaultValue("authenticated") String audience
    ) {
    }
}
