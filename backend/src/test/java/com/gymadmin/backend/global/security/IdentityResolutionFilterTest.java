package com.gymadmin.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.gymadmin.backend.global.error.ErrorCode;
import com.gymadmin.backend.global.error.ProblemException;
import com.gymadmin.backend.modules.access.application.PermissionRegistry;
import com.gymadmin.backend.modules.identity.application.IdentityResolver;
import com.gymadmin.backend.modules.identity.domain.AuthMode;
import com.gymadmin.backend.modules.identity.domain.AuthenticatedPrincipal;
import com.gymadmin.backend.modules.identity.domain.RequestCredentials;
import com.gymadmin.backend.modules.identity.domain.ResolutionMode;
import com.gymadmin.backend.modules.identity.infrastructure.AuthProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

@ExtendWith(MockitoExtension.class)
class IdentityResolutionFilterTest {

    @Mock
    private IdentityResolver identityResolver;

    private IdentityResolutionFilter filter;

    @BeforeEach
    void setUp() {
        AuthProperties properties = new AuthProperties(AuthMode.STRICT, "manager",
                new AuthProperties.Platform("secret", "authenticated"),
                List.of("/staff/login", "/staff/branch/**"));
        filter = new IdentityResolutionFilter(identityResolver, new PermissionRegistry(),
                new ProblemResponseWriter(new ObjectMapper()), properties);
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void resolvedPrincipalBecomesAuthenticationWithPermissionAuthorities() throws Exception {
        AuthenticatedPrincipal principal = AuthenticatedPrincipal.platformToken("u-1", "m@gym.test", "member");
        when(identityResolver.resolve(any(RequestCredentials.class), eq(ResolutionMode.REQUIRED)))
                .thenReturn(Optional.of(principal));
        MockHttpServletRequest request = request("GET", "/auth/permissions");
        request.addHeader("Authorization", "Bearer abc");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication.getPrincipal()).isEqualTo(principal);
        assertThat(authentication.getAuthorities()).extracting(GrantedAuthority::getAuthority)
                .containsExactlyInAnyOrder("branches:read", "packages:read");
    }

    @Test
    void unresolvedRequestGetsProblemBodyAndStops() throws Exception {
        when(identityResolver.resolve(any(RequestCredentials.class), eq(ResolutionMode.REQUIRED)))
                .thenThrow(new ProblemException(ErrorCode.UNAUTHENTICATED, "Authentication required"));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("GET", "/auth/permissions"), response, chain);

        assertThat(chain.getRequest()).isNull();
        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentType()).startsWith("application/problem+json");
        assertThat(response.getContentAsString()).contains("\"code\":\"UNAUTHENTICATED\"");
    }

    @Test
    void publicPathsResolveOptionally() throws Exception {
        when(identityResolver.resolve(any(RequestCredentials.class), eq(ResolutionMode.OPTIONAL)))
                .thenReturn(Optional.empty());
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("GET", "/staff/branch/abc"), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    void healthProbeIsNotFiltered() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("GET", "/actuator/health/liveness"), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
        verifyNoInteractions(identityResolver);
    }

    @Test
    void credentialsAreReadFromBothHeaders() {
        MockHttpServletRequest request = request("GET", "/auth/permissions");
        request.addHeader("Authorization", "Bearer  token-1 ");
        request.addHeader(IdentityResolutionFilter.SESSION_TOKEN_HEADER, "session-1");

        RequestCredentials credentials = IdentityResolutionFilter.extractCredentials(request);

        assertThat(credentials.bearerToken()).isEqualTo("token-1");
        assertThat(credentials.sessionToken()).isEqualTo("session-1");
    }

    @Test
    void nonBearerAuthorizationIsIgnored() {
        MockHttpServletRequest request = request("GET", "/auth/permissions");
        request.addHeader("Authorization", "Basic dXNlcjpwYXNz");

        assertThat(IdentityResolutionFilter.extractCredentials(request).isEmpty()).isTrue();
    }

    private static MockHttpServletRequest request(String method, String path) {
        MockHttpServletRequest request = new MockHttpServletRequest(method, path);
        request.setServletPath(path);
        return request;
    }
}
