package com.gymadmin.backend.global.config;

import java.util.ArrayList;
import java.util.List;

import com.gymadmin.backend.modules.identity.application.BranchSessionResolutionStrategy;
import com.gymadmin.backend.modules.identity.application.DevelopmentBypassResolutionStrategy;
import com.gymadmin.backend.modules.identity.application.IdentityResolutionStrategy;
import com.gymadmin.backend.modules.identity.application.IdentityResolver;
import com.gymadmin.backend.modules.identity.application.PlatformTokenResolutionStrategy;
import com.gymadmin.backend.modules.identity.infrastructure.AuthProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;

/**
 * Builds the identity resolver with its strategy order fixed here: branch session first, platform token second,
 * and the development bypass last and only when {@code app.auth.mode=DEVELOPMENT_BYPASS}.
 */
@Configuration
public class IdentityConfig {

    private static final Logger log = LoggerFactory.getLogger(IdentityConfig.class);
    static final String PRODUCTION_PROFILE = "prod";

    @Bean
    public IdentityResolver identityResolver(
            BranchSessionResolutionStrategy branchSessionStrategy,
            PlatformTokenResolutionStrategy platformTokenStrategy,
            AuthProperties authProperties,
            Environment environment
    ) {
        List<IdentityResolutionStrategy> strategies = new ArrayList<>();
        strategies.add(branchSessionStrategy);
        strategies.add(platformTokenStrategy);

        if (authProperties.isDevelopmentBypass()) {
            if (environment.acceptsProfiles(Profiles.of(PRODUCTION_PROFILE))) {
                throw new IllegalStateException(
                        "app.auth.mode=DEVELOPMENT_BYPASS cannot be used with the prod profile");
            }
            log.warn("Authentication bypass enabled: unauthenticated requests resolve to a synthetic '{}' principal",
                    authProperties.bypassRole());
            strategies.add(new DevelopmentBypassResolutionStrategy(authProperties.bypassRole()));
        }
        return new IdentityResolver(strategies);
    }
}
