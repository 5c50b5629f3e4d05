package com.gymadmin.backend.modules.identity.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.UUID;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.gymadmin.backend.modules.identity.application.InvalidTokenException;
import com.gymadmin.backend.modules.identity.application.PlatformIdentity;
import com.gymadmin.backend.modules.identity.application.PlatformTokenVerifier;
import com.gymadmin.backend.modules.identity.infrastructure.AuthProperties;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * HS256 verifier for platform access tokens. The shared secret may be Base64 or plain text.
 */
@Component
public class JwtPlatformTokenVerifier implements PlatformTokenVerifier {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final String EMAIL_CLAIM = "email";

    private final SecretKey secretKey;
    private final String audience;

    public JwtPlatformTokenVerifier(AuthProperties authProperties) {
        AuthProperties.Platform platform = authProperties.platform();
        if (platform == null || !StringUtils.hasText(platform.jwtSecret())) {
            throw new IllegalStateException("app.auth.platform.jwt-secret must be configured");
        }
        this.secretKey = toKey(platform.jwtSecret());
        this.audience = platform.audience();
    }

    static SecretKey toKey(String secretString) {
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            keyBytes = secretString.getBytes(StandardCharsets.UTF_8);
        }
        return new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    @Override
    public PlatformIdentity verify(String token) {
        Claims claims;
        try {
            JwtParserBuilder parserBuilder = Jwts.parser().verifyWith(secretKey);
            if (StringUtils.hasText(audience)) {
                parserBuilder = parserBuilder.requireAudience(audience);
            }
            claims = parserBuilder.build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException ex) {
            throw new InvalidTokenException("Invalid platform token", ex);
        }

        String subject = claims.getSubject();
        if (!StringUtils.hasText(subject)) {
            throw new InvalidTokenException("Platform token has no subject");
        }
        UUID userId;
        try {
            userId = UUID.fromString(subject);
        } catch (IllegalArgumentException ex) {
            throw new InvalidTokenException("Platform token subject is not a user id", ex);
        }
        return new PlatformIdentity(userId, claims.get(EMAIL_CLAIM, String.class));
    }
}
