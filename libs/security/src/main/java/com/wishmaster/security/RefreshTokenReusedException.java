package com.wishmaster.security;

import java.util.UUID;

/**
 * A refresh token was presented whose id is no longer active: it was already exchanged,
 * revoked by logout, or pruned. Raising this also revokes every refresh token of the principal.
 */
public class RefreshTokenReusedException extends TokenException {

    private final UUID principalId;
    private final long tokenId;

    public RefreshTokenReusedException(UUID principalId, long tokenId) {
        super("Refresh token %d of principal %s is no longer active".formatted(tokenId, principalId));
        this.principalId = principalId;
        this.tokenId = tokenId;
    }

    public UUID principalId() {
        return principalId;
    }

    public long tokenId() {
        return tokenId;
    }
}
