package com.gymadmin.backend.modules.identity.application;

import com.gymadmin.backend.modules.identity.domain.IdentityResolution;
import com.gymadmin.backend.modules.identity.domain.RequestCredentials;

/**
 * One way of turning request credentials into a principal. Strategies never throw to signal "try the next one";
 * they return {@link IdentityResolution#notApplicable()} or {@link IdentityResolution#failed(String)} instead.
 * Storage failures are not caught here and reach the resolver as {@code DataAccessException}.
 */
public interface IdentityResolutionStrategy {

    String name();

    IdentityResolution resolve(RequestCredentials credentials);

    /**
     * Synthetic strategies are consulted only when no earlier strategy found a credential to verify.
     */
    default boolean synthetic() {
        return false;
    }
}
