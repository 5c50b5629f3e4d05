package com.gymadmin.backend.modules.identity.domain;

/**
 * Startup-selected authentication mode. {@link #DEVELOPMENT_BYPASS} registers a synthetic principal as the last
 * resolution strategy and is rejected when the {@code prod} profile is active.
 */
public enum AuthMode {
    STRICT,
    DEVELOPMENT_BYPASS
}
