package com.wishmaster.security;

import java.util.Set;
import java.util.UUID;

/**
 * Identity of a caller as loaded from the {@link PrincipalDirectory}.
 * <p>
 * {@code groups} is the membership snapshot taken when the principal was loaded. Permission
 * checks do not rely on it: {@link AuthorizationManager} re-reads memberships on every call.
 *
 * @param id     unique principal id (the {@code id} claim of issued tokens)
 * @param status lifecycle status
 * @param groups group memberships at load time
 */
public record Principal(UUID id, PrincipalStatus status, Set<Group> groups) {

    public Principal {
        if (id == null) {
            throw new IllegalArgumentException("id must not be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        groups = groups == null ? Set.of() : Set.copyOf(groups);
    }

    /** Whether this principal may authenticate. */
    public boolean isActive() {
        return status.canAuthenticate();
    }
}
