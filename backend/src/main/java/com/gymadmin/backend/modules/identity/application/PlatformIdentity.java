package com.gymadmin.backend.modules.identity.application;

import java.util.UUID;

/**
 * Identity asserted by a verified platform bearer token.
 */
public record PlatformIdentity(UUID userId, String email) {
}
