package com.gymadmin.backend.modules.identity.application;

import java.util.List;
import java.util.Optional;

import com.gymadmin.backend.global.error.ErrorCode;
import com.gymadmin.backend.global.error.ProblemException;
import com.gymadmin.backend.modules.identity.domain.AuthenticatedPrincipal;
import com.gymadmin.backend.modules.identity.domain.IdentityResolution;
import com.gymadmin.backend.modules.identity.domain.RequestCredentials;
import com.gymadmin.backend.modules.identity.domain.ResolutionMode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

/**
 * Walks an ordered list of strategies and returns the first resolved principal.
 * <p>
 * A {@code Failed} result does not stop the walk, so a stale session token does not hide a valid bearer token,
 * but it does disable synthetic strategies for the rest of the request.
 */
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);
    static final String UNAUTHENTICATED_MESSAGE = "Authentication required";

    private final List<IdentityResolutionStrategy> strategies;

    public IdentityResolver(List<IdentityResolutionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public List<String> strategyNames() {
        return strategies.stream().map(IdentityResolutionStrategy::name).toList();
    }

    /**
     * @return the principal, or empty only in {@link ResolutionMode#OPTIONAL}
     * @throws ProblemException {@code UNAUTHENTICATED} in {@link ResolutionMode#REQUIRED} when nothing resolves,
     *                          {@code STORAGE_UNAVAILABLE} when the credential store cannot be reached
     */
    public Optional<AuthenticatedPrincipal> resolve(RequestCredentials credentials, ResolutionMode mode) {
        if (mode == ResolutionMode.OPTIONAL && credentials.isEmpty()) {
            return Optional.empty();
        }

        boolean credentialRejected = false;
        for (IdentityResolutionStrategy strategy : strategies) {
            if (strategy.synthetic() && credentialRejected) {
                continue;
            }
            IdentityResolution resolution = evaluate(strategy, credentials);
            if (resolution instanceof IdentityResolution.Resolved resolved) {
                if (resolved.principal().synthetic()) {
                    log.debug("Request resolved to synthetic principal via {}", strategy.name());
                }
                return Optional.of(resolved.principal());
            }
            if (resolution instanceof IdentityResolution.Failed failed) {
                log.debug("Identity strategy {} rejected credential: {}", strategy.name(), failed.reason());
                credentialRejected = true;
            }
        }

        if (mode == ResolutionMode.OPTIONAL) {
            return Optional.empty();
        }
        throw new ProblemException(ErrorCode.UNAUTHENTICATED, UNAUTHENTICATED_MESSAGE);
    }

    private IdentityResolution evaluate(IdentityResolutionStrategy strategy, RequestCredentials credentials) {
        try {
            return strategy.resolve(credentials);
        } catch (DataAccessException | TransactionException ex) {
            log.error("Identity strategy {} could not reach the credential store", strategy.name(), ex);
            throw new ProblemException(ErrorCode.STORAGE_UNAVAILABLE, "Credential store unavailable");
        }
    }
}
