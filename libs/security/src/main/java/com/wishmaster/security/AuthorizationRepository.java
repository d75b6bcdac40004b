package com.wishmaster.security;

import java.util.Set;
import java.util.UUID;

/**
 * Read-only queries over the group → role → permission graph.
 * <p>
 * Each method returns the current persisted state; {@link AuthorizationManager} composes
 * them with explicit set unions. Implementations must be safe for concurrent use and may
 * return empty sets but never null.
 */
public interface AuthorizationRepository {

    /** Groups the principal currently belongs to. */
    Set<Group> findGroupsFor(UUID principalId);

    /** Roles granted to the group. */
    Set<Role> findRolesFor(Group group);

    /** Permissions granted to the role. */
    Set<Permission> findPermissionsFor(Role role);
}
