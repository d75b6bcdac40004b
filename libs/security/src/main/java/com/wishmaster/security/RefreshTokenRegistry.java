package com.wishmaster.security;

import java.time.Instant;
import java.util.UUID;

/**
 * Tracks which refresh tokens are still exchangeable. Each refresh token id may be consumed
 * exactly once.
 */
public interface RefreshTokenRegistry {

    /**
     * Allocates and records a new refresh token id.
     *
     * @param principalId owner of the token
     * @param expiresAt   expiry of the token; the entry is dropped afterwards
     * @return the new token id, unique within this registry
     */
    long register(UUID principalId, Instant expiresAt);

    /**
     * Atomically removes an active token id.
     *
     * @return true if the id was active and unexpired, false otherwise
     */
    boolean consume(UUID principalId, long tokenId);

    /**
     * Removes every refresh token of the principal.
     */
    void revokeAll(UUID principalId);
}
