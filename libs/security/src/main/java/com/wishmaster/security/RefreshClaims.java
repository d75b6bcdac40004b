package com.wishmaster.security;

import java.util.UUID;

/**
 * Claims of a refresh token: the principal id plus the registry id used for rotation.
 *
 * @param principalId the principal the token was issued to
 * @param tokenId     id of this refresh token in the {@link RefreshTokenRegistry}
 */
public record RefreshClaims(UUID principalId, long tokenId) implements TokenClaims {

    public RefreshClaims {
        if (principalId == null) {
            throw new IllegalArgumentException("principalId must not be null");
        }
    }

    @Override
    public TokenAudience audience() {
        return TokenAudience.REFRESH;
    }
}
