package com.wishmaster.security;

import java.util.Optional;
import java.util.UUID;

/**
 * Read-only lookup of principals, implemented by the persistence layer.
 * <p>
 * Implementations may block on I/O and must be safe for concurrent use. Storage failures
 * propagate as unchecked exceptions; the security core never retries.
 */
public interface PrincipalDirectory {

    /**
     * Loads a principal with its current status and group memberships.
     *
     * @param id principal id
     * @return the principal, or empty if no principal has this id
     */
    Optional<Principal> findPrincipalById(UUID id);
}
