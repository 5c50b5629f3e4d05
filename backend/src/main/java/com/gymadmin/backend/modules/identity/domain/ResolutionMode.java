package com.gymadmin.backend.modules.identity.domain;

/**
 * How an endpoint treats a request that cannot be resolved to a principal.
 * {@link #OPTIONAL} is reserved for public endpoints and continues anonymously.
 */
public enum ResolutionMode {
    REQUIRED,
    OPTIONAL
}
