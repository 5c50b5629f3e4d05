package com.gymadmin.backend.modules.identity.application;

/**
 * Verifies bearer tokens issued by the hosted identity platform.
 */
public interface PlatformTokenVerifier {

    /**
     * @throws InvalidTokenException when the signature, expiry, audience or subject does not check out
     */
    PlatformIdentity verify(String token);
}
