package com.gymadmin.backend.modules.identity.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.gymadmin.backend.global.error.ErrorCode;
import com.gymadmin.backend.global.error.ProblemException;
import com.gymadmin.backend.modules.identity.domain.AuthenticatedPrincipal;
import com.gymadmin.backend.modules.identity.domain.IdentityResolution;
import com.gymadmin.backend.modules.identity.domain.RequestCredentials;
import com.gymadmin.backend.modules.identity.domain.ResolutionMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;

class IdentityResolverTest {

    private static final AuthenticatedPrincipal STAFF = AuthenticatedPrincipal.branchSession(
            "staff-1", "staff@gym.test", "associate", "11111111-1111-1111-1111-111111111111");
    private static final AuthenticatedPrincipal PLATFORM_USER = AuthenticatedPrincipal.platformToken(
            "user-1", "user@gym.test", "manager");

    private final List<String> invoked = new ArrayList<>();

    @Test
    void firstResolvedStrategyWins() {
        IdentityResolver resolver = new IdentityResolver(List.of(
                strategy("branch-session", credentials -> IdentityResolution.resolved(STAFF)),
                strategy("platform-token", credentials -> IdentityResolution.resolved(PLATFORM_USER))
        ));

        Optional<AuthenticatedPrincipal> principal = resolver.resolve(
                new RequestCredentials("bearer", "session"), ResolutionMode.REQUIRED);

        assertThat(principal).contains(STAFF);
        assertThat(invoked).containsExactly("branch-session");
    }

    @Test
    void failedStrategyFallsThroughToNextOne() {
        IdentityResolver resolver = new IdentityResolver(List.of(
                strategy("branch-session", credentials -> IdentityResolution.failed("expired")),
                strategy("platform-token", credentials -> IdentityResolution.resolved(PLATFORM_USER))
        ));

        Optional<AuthenticatedPrincipal> principal = resolver.resolve(
                new RequestCredentials("bearer", "stale"), ResolutionMode.REQUIRED);

        assertThat(principal).contains(PLATFORM_USER);
    }

    @Test
    void rejectedCredentialNeverFallsBackToSyntheticPrincipal() {
        IdentityResolver resolver = new IdentityResolver(List.of(
                strategy("platform-token", credentials -> IdentityResolution.failed("bad signature")),
                new DevelopmentBypassResolutionStrategy("manager")
        ));

        ProblemException ex = assertThrows(ProblemException.class,
                () -> resolver.resolve(new RequestCredentials("forged", null), ResolutionMode.REQUIRED));

        assertThat(ex.getCode()).isEqualTo(ErrorCode.UNAUTHENTICATED.name());
    }

    @Test
    void bypassResolvesRequestsWithoutCredentials() {
        IdentityResolver resolver = new IdentityResolver(List.of(
                strategy("platform-token", credentials -> IdentityResolution.notApplicable()),
                new DevelopmentBypassResolutionStrategy("manager")
        ));

        AuthenticatedPrincipal principal = resolver.resolve(RequestCredentials.none(), ResolutionMode.REQUIRED)
                .orElseThrow();

        assertThat(principal.synthetic()).isTrue();
        assertThat(principal.role()).isEqualTo("manager");
        assertThat(principal.id()).isEqualTo(AuthenticatedPrincipal.SYNTHETIC_ID);
    }

    @Test
    void requiredModeWithoutCredentialsIsUnauthenticated() {
        IdentityResolver resolver = new IdentityResolver(List.of(
                strategy("platform-token", credentials -> IdentityResolution.notApplicable())
        ));

        ProblemException ex = assertThrows(ProblemException.class,
                () -> resolver.resolve(RequestCredentials.none(), ResolutionMode.REQUIRED));

        assertThat(ex.getStatusCode().value()).isEqualTo(401);
    }

    @Test
    void optionalModeSkipsStrategiesWhenNoCredentialsPresent() {
        IdentityResolver resolver = new IdentityResolver(List.of(
                strategy("platform-token", credentials -> IdentityResolution.resolved(PLATFORM_USER))
        ));

        assertThat(resolver.resolve(RequestCredentials.none(), ResolutionMode.OPTIONAL)).isEmpty();
        assertThat(invoked).isEmpty();
    }

    @Test
    void optionalModeWithRejectedCredentialContinuesAnonymously() {
        IdentityResolver resolver = new IdentityResolver(List.of(
                strategy("platform-token", credentials -> IdentityResolution.failed("expired"))
        ));

        assertThat(resolver.resolve(new RequestCredentials("expired", null), ResolutionMode.OPTIONAL)).isEmpty();
    }

    @Test
    void storageFailureIsReportedAsUnavailable() {
        IdentityResolver resolver = new IdentityResolver(List.of(
                strategy("branch-session", credentials -> {
                    throw new DataAccessResourceFailureException("connection refused");
                })
        ));

        ProblemException ex = assertThrows(ProblemException.class,
                () -> resolver.resolve(new RequestCredentials(null, "token"), ResolutionMode.REQUIRED));

        assertThat(ex.getCode()).isEqualTo(ErrorCode.STORAGE_UNAVAILABLE.name());
        assertThat(ex.getStatusCode().value()).isEqualTo(503);
    }

    @Test
    void transactionThatCannotStartIsReportedAsUnavailable() {
        IdentityResolver resolver = new IdentityResolver(List.of(
                strategy("platform-token", credentials -> {
                    throw new CannotCreateTransactionException("Could not open JPA EntityManager for transaction");
                })
        ));

        ProblemException ex = assertThrows(ProblemException.class,
                () -> resolver.resolve(new RequestCredentials("jwt", null), ResolutionMode.REQUIRED));

        assertThat(ex.getCode()).isEqualTo(ErrorCode.STORAGE_UNAVAILABLE.name());
        assertThat(ex.getStatusCode().value()).isEqualTo(503);
    }

    @Test
    void strategyNamesKeepRegistrationOrder() {
        IdentityResolver resolver = new IdentityResolver(List.of(
                strategy("branch-session", credentials -> IdentityResolution.notApplicable()),
                strategy("platform-token", credentials -> IdentityResolution.notApplicable()),
                new DevelopmentBypassResolutionStrategy("manager")
        ));

        assertThat(resolver.strategyNames())
                .containsExactly("branch-session", "platform-token", "development-bypass");
    }

    private IdentityResolutionStrategy strategy(String name,
                                                Function<RequestCredentials, IdentityResolution> behaviour) {
        return new IdentityResolutionStrategy() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public IdentityResolution resolve(RequestCredentials credentials) {
                invoked.add(name);
                return behaviour.apply(credentials);
            }
        };
    }
}
