package com.gymadmin.backend.modules.identity.domain;

import java.util.Objects;

/**
 * Tagged outcome of a single resolution strategy.
 */
public sealed interface IdentityResolution {

    static IdentityResolution resolved(AuthenticatedPrincipal principal) {
        return new Resolved(principal);
    }

    static IdentityResolution notApplicable() {
        return NotApplicable.INSTANCE;
    }

    static IdentityResolution failed(String reason) {
        return new Failed(reason);
    }

    record Resolved(AuthenticatedPrincipal principal) implements IdentityResolution {
        public Resolved {
            Objects.requireNonNull(principal, "principal is required");
        }
    }

    /**
     * The request carries no credential this strategy understands.
     */
    record NotApplicable() implements IdentityResolution {
        static final NotApplicable INSTANCE = new NotApplicable();
    }

    /**
     * The strategy's credential was present but did not verify. The reason is for logs only.
     */
    record Failed(String reason) implements IdentityResolution {
    }
}
