package com.gymadmin.backend.modules.identity.application;

import com.gymadmin.backend.modules.identity.domain.AuthenticatedPrincipal;
import com.gymadmin.backend.modules.identity.domain.IdentityResolution;
import com.gymadmin.backend.modules.identity.domain.RequestCredentials;
import com.gymadmin.backend.modules.identity.domain.UserProfile;
import com.gymadmin.backend.modules.identity.infrastructure.persistence.UserProfileRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Resolves platform bearer tokens. The role comes from the {@code gym_user} profile row and defaults to
 * {@value #DEFAULT_ROLE} when the user has no profile yet.
 */
@Component
public class PlatformTokenResolutionStrategy implements IdentityResolutionStrategy {

    public static final String DEFAULT_ROLE = "member";

    private final PlatformTokenVerifier tokenVerifier;
    private final UserProfileRepository userProfileRepository;

    public PlatformTokenResolutionStrategy(PlatformTokenVerifier tokenVerifier,
                                           UserProfileRepository userProfileRepository) {
        this.tokenVerifier = tokenVerifier;
        this.userProfileRepository = userProfileRepository;
    }

    @Override
    public String name() {
        return "platform-token";
    }

    @Override
    @Transactional(readOnly = true)
    public IdentityResolution resolve(RequestCredentials credentials) {
        if (!credentials.hasBearerToken()) {
            return IdentityResolution.notApplicable();
        }
        PlatformIdentity identity;
        try {
            identity = tokenVerifier.verify(credentials.bearerToken());
        } catch (InvalidTokenException ex) {
            return IdentityResolution.failed(ex.getMessage());
        }

        return userProfileRepository.findByAuthUserId(identity.userId())
                .map(profile -> IdentityResolution.resolved(fromProfile(identity, profile)))
                .orElseGet(() -> IdentityResolution.resolved(AuthenticatedPrincipal.platformToken(
                        identity.userId().toString(), identity.email(), DEFAULT_ROLE)));
    }

    private AuthenticatedPrincipal fromProfile(PlatformIdentity identity, UserProfile profile) {
        String email = StringUtils.hasText(identity.email()) ? identity.email() : profile.getEmail();
        String role = StringUtils.hasText(profile.getRole()) ? profile.getRole() : DEFAULT_ROLE;
        return AuthenticatedPrincipal.platformToken(identity.userId().toString(), email, role);
    }
}
