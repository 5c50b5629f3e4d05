package com.gymadmin.backend.global.security;

import java.util.Collection;

import com.gymadmin.backend.modules.identity.domain.AuthenticatedPrincipal;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;

/**
 * Spring Security view of a resolved {@link AuthenticatedPrincipal}. Authorities are permission tokens.
 */
public class PrincipalAuthenticationToken extends AbstractAuthenticationToken {

    private final AuthenticatedPrincipal principal;

    public PrincipalAuthenticationToken(AuthenticatedPrincipal principal,
                                        Collection<? extends GrantedAuthority> authorities) {
        super(authorities);
        this.principal = principal;
        setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
        return "";
    }

    @Override
    public AuthenticatedPrincipal getPrincipal() {
        return principal;
    }

    @Override
    public String getName() {
        return principal.id();
    }
}
