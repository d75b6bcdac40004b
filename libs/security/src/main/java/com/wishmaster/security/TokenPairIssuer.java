package com.wishmaster.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Issues token pairs at login and rotates them on refresh.
 * <p>
 * Refresh tokens are single-use: a successful refresh consumes the presented token id and
 * issues a pair with a fresh one. Presenting an id that is no longer active is treated as
 * token theft, so every refresh token of that principal is revoked.
 */
public class TokenPairIssuer {

    private static final Logger log = LoggerFactory.getLogger(TokenPairIssuer.class);

    private final TokensManager tokensManager;
    private final PrincipalDirectory directory;
    private final RefreshTokenRegistry registry;

    public TokenPairIssuer(TokensManager tokensManager, PrincipalDirectory directory, RefreshTokenRegistry registry) {
        if (tokensManager == null || directory == null || registry == null) {
            throw new IllegalArgumentException("tokensManager, directory and registry must not be null");
        }
        this.tokensManager = tokensManager;
        this.directory = directory;
        this.registry = registry;
    }

    /**
     * Issues a new pair for a principal that has already proven its identity.
     *
     * @throws InactivePrincipalException if the principal is not CONFIRMED
     */
    public TokenPair issue(Principal principal) {
        requireActive(principal);
        Instant refreshExpiresAt = tokensManager.expiryFor(tokensManager.config().refreshLifetime());
        long tokenId = registry.register(principal.id(), refreshExpiresAt);
        TokenPair pair = tokensManager.createPair(principal.id(), tokenId);
        log.info("Issued token pair for principal {} with refresh token {}", principal.id(), tokenId);
        return pair;
    }

    /**
     * Exchanges a refresh token for a new pair.
     *
     * @throws TokenException                 if the token is invalid, expired, not a refresh token, or reused
     * @throws AuthenticationFailedException  if the principal no longer exists
     * @throws InactivePrincipalException     if the principal is not CONFIRMED; nothing is issued or consumed
     */
    public TokenPair refresh(String refreshToken) {
        RefreshClaims claims = tokensManager.decodeRefresh(refreshToken);
        Principal principal = directory.findPrincipalById(claims.principalId())
                .orElseThrow(() -> new AuthenticationFailedException(RejectionReason.UNKNOWN_PRINCIPAL));
        requireActive(principal);

        if (!registry.consume(principal.id(), claims.tokenId())) {
            registry.revokeAll(principal.id());
            log.warn("Refresh token {} of principal {} is no longer active; revoked all refresh tokens",
                    claims.tokenId(), principal.id());
            throw new RefreshTokenReusedException(principal.id(), claims.tokenId());
        }
        return issue(principal);
    }

    /**
     * Invalidates a refresh token (logout). Revoking an already inactive token is a no-op.
     *
     * @throws TokenException if the token is not a valid refresh token
     */
    public void revoke(String refreshToken) {
        RefreshClaims claims = tokensManager.decodeRefresh(refreshToken);
        boolean revoked = registry.consume(claims.principalId(), claims.tokenId());
        log.info("Revoked refresh token {} of principal {} (was active: {})",
                claims.tokenId(), claims.principalId(), revoked);
    }

    private static void requireActive(Principal principal) {
        if (principal == null) {
            throw new IllegalArgumentException("principal must not be null");
        }
        if (!principal.isActive()) {
            throw new InactivePrincipalException(principal.id(), principal.status());
        }
    }
}
