package com.gymadmin.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.gymadmin.backend.global.error.ProblemException;
import com.gymadmin.backend.modules.access.application.PermissionRegistry;
import com.gymadmin.backend.modules.access.domain.Permission;
import com.gymadmin.backend.modules.identity.application.IdentityResolver;
import com.gymadmin.backend.modules.identity.domain.AuthenticatedPrincipal;
import com.gymadmin.backend.modules.identity.domain.RequestCredentials;
import com.gymadmin.backend.modules.identity.domain.ResolutionMode;
import com.gymadmin.backend.modules.identity.infrastructure.AuthProperties;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the request principal before Spring Security authorizes the route. Public paths are resolved in
 * {@link ResolutionMode#OPTIONAL}; everything else requires a principal.
 */
@Component
public class IdentityResolutionFilter extends OncePerRequestFilter {

    public static final String SESSION_TOKEN_HEADER = "X-Session-Token";
    private static final String BEARER_PREFIX = "Bearer ";
    private static final List<String> UNFILTERED_PATHS = List.of(
            "/actuator/health/**", "/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html");

    private final IdentityResolver identityResolver;
    private final PermissionRegistry permissionRegistry;
    private final ProblemResponseWriter problemResponseWriter;
    private final List<String> publicPaths;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public IdentityResolutionFilter(
            IdentityResolver identityResolver,
            PermissionRegistry permissionRegistry,
            ProblemResponseWriter problemResponseWriter,
            AuthProperties authProperties
    ) {
        this.identityResolver = identityResolver;
        this.permissionRegistry = permissionRegistry;
        this.problemResponseWriter = problemResponseWriter;
        this.publicPaths = List.copyOf(authProperties.publicPaths());
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        ResolutionMode mode = isPublic(request) ? ResolutionMode.OPTIONAL : ResolutionMode.REQUIRED;
        Optional<AuthenticatedPrincipal> principal;
        try {
            principal = identityResolver.resolve(extractCredentials(request), mode);
        } catch (ProblemException ex) {
            SecurityContextHolder.clearContext();
            problemResponseWriter.write(request, response, ex);
            return;
        }

        principal.ifPresent(resolved -> authenticate(request, resolved));
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        String path = request.getServletPath();
        return UNFILTERED_PATHS.stream().anyMatch(pattern -> pathMatcher.match(pattern, path));
    }

    private boolean isPublic(HttpServletRequest request) {
        String path = request.getServletPath();
        return publicPaths.stream().anyMatch(pattern -> pathMatcher.match(pattern, path));
    }

    private void authenticate(HttpServletRequest request, AuthenticatedPrincipal principal) {
        List<SimpleGrantedAuthority> authorities = permissionRegistry.permissionsFor(principal.role()).stream()
                .map(Permission::token)
                .map(SimpleGrantedAuthority::new)
                .toList();
        PrincipalAuthenticationToken authentication = new PrincipalAuthenticationToken(principal, authorities);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
    }

    static RequestCredentials extractCredentials(HttpServletRequest request) {
        String bearer = null;
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            bearer = authorization.substring(BEARER_PREFIX.length()).trim();
        }
        return new RequestCredentials(bearer, request.getHeader(SESSION_TOKEN_HEADER));
    }
}
