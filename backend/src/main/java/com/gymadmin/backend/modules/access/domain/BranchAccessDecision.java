package com.gymadmin.backend.modules.access.domain;

/**
 * Outcome of the branch isolation check.
 */
public enum BranchAccessDecision {
    /** The principal holds {@code system:admin} or {@code branches:manage_all}. */
    ALLOWED_GLOBAL,
    /** Branch-session principal acting on its own branch. */
    ALLOWED_SAME_BRANCH,
    DENIED,
    /**
     * Platform-token principal with no branch affiliation. Branch isolation does not apply; the route's own
     * permission check decides.
     */
    DEFERRED_TO_PERMISSION_CHECK;

    public boolean isDenied() {
        return this == DENIED;
    }
}
