package com.wishmaster.security;

import java.util.Optional;

/**
 * Outcome of {@link BearerTokenAuthenticator#authenticate(String)}.
 * <ul>
 *   <li>{@link Anonymous}: no credentials for the configured scheme; the request may proceed
 *       unauthenticated and will be denied by any permission check.</li>
 *   <li>{@link Authenticated}: a valid access token for an active principal.</li>
 *   <li>{@link Rejected}: credentials were presented but are unusable.</li>
 * </ul>
 */
public sealed interface AuthenticationResult
        permits AuthenticationResult.Anonymous, AuthenticationResult.Authenticated, AuthenticationResult.Rejected {

    /** Shared anonymous result. */
    static Anonymous anonymous() {
        return Anonymous.INSTANCE;
    }

    /** The authenticated principal, if any. */
    default Optional<Principal> authenticatedPrincipal() {
        return this instanceof Authenticated authenticated
                ? Optional.of(authenticated.principal())
                : Optional.empty();
    }

    /**
     * Returns the authenticated principal or raises {@link AuthenticationFailedException}.
     * Anonymous results fail with {@link RejectionReason#NOT_AUTHENTICATED}.
     */
    default Principal requireAuthenticated() {
        if (this instanceof Authenticated authenticated) {
            return authenticated.principal();
        }
        if (this instanceof Rejected rejected) {
            throw new AuthenticationFailedException(rejected.reason());
        }
        throw new AuthenticationFailedException(RejectionReason.NOT_AUTHENTICATED);
    }

    /** No credentials for the configured scheme. */
    record Anonymous() implements AuthenticationResult {
        private static final Anonymous INSTANCE = new Anonymous();
    }

    /**
     * Valid credentials.
     *
     * @param principal the active principal
     * @param claims    claims of the presented access token
     */
    record Authenticated(Principal principal, AccessClaims claims) implements AuthenticationResult {
    }

    /**
     * Unusable credentials.
     *
     * @param reason why they were rejected
     */
    record Rejected(RejectionReason reason) implements AuthenticationResult {
    }
}
