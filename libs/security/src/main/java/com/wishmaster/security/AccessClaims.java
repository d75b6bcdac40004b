package com.wishmaster.security;

import java.util.UUID;

/**
 * Claims of an access token: the principal id only.
 *
 * @param principalId the principal the token was issued to
 */
public record AccessClaims(UUID principalId) implements TokenClaims {

    public AccessClaims {
        if (principalId == null) {
            throw new IllegalArgumentException("principalId must not be null");
        }
    }

    @Override
    public TokenAudience audience() {
        return TokenAudience.ACCESS;
    }
}
