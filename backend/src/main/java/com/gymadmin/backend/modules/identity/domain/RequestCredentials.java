package com.gymadmin.backend.modules.identity.domain;

import org.springframework.util.StringUtils;

/**
 * Credential material attached to a single request.
 */
public record RequestCredentials(String bearerToken, String sessionToken) {

    public static RequestCredentials none() {
        return new RequestCredentials(null, null);
    }

    public boolean hasBearerToken() {
        return StringUtils.hasText(bearerToken);
    }

    public boolean hasSessionToken() {
        return StringUtils.hasText(sessionToken);
    }

    public boolean isEmpty() {
        return !hasBearerToken() && !hasSessionToken();
    }

    @Override
    public String toString() {
        return "RequestCredentials[bearer=" + hasBearerToken() + ", session=" + hasSessionToken() + "]";
    }
}
