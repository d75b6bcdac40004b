package com.wishmaster.security;

import java.util.HashSet;
import java.util.Set;

/**
 * Decides whether a principal holds a named permission.
 * <p>
 * The effective permission set is the union of permissions over every role of every group
 * the principal belongs to. It is resolved from the {@link AuthorizationRepository} on each
 * call because memberships may change between requests. Names are compared exactly; there
 * are no wildcards and no implied permissions.
 */
public class AuthorizationManager {

    private final AuthorizationRepository repository;

    public AuthorizationManager(AuthorizationRepository repository) {
        if (repository == null) {
            throw new IllegalArgumentException("repository must not be null");
        }
        this.repository = repository;
    }

    /**
     * Resolves the principal's current permission names.
     *
     * @param principal the principal
     * @return immutable set, empty for a principal without groups
     */
    public Set<String> effectivePermissions(Principal principal) {
        if (principal == null) {
            throw new IllegalArgumentException("principal must not be null");
        }
        Set<String> permissions = new HashSet<>();
        for (Group group : repository.findGroupsFor(principal.id())) {
            for (Role role : repository.findRolesFor(group)) {
                for (Permission permission : repository.findPermissionsFor(role)) {
                    permissions.add(permission.name());
                }
            }
        }
        return Set.copyOf(permissions);
    }

    /**
     * Checks whether the principal currently holds the permission.
     *
     * @param principal  the principal (null is treated as "no principal" and denied)
     * @param permission exact permission name; a null or blank name is never held
     */
    public boolean hasPermission(Principal principal, String permission) {
        if (principal == null || permission == null || permission.isBlank()) {
            return false;
        }
        return effectivePermissions(principal).contains(permission);
    }

    /**
     * Checks the permission for the outcome of bearer authentication. Anonymous and rejected
     * callers hold no permissions.
     */
    public boolean hasPermission(AuthenticationResult result, String permission) {
        return result.authenticatedPrincipal()
                .map(principal -> hasPermission(principal, permission))
                .orElse(false);
    }

    /**
     * Guard variant of {@link #hasPermission(Principal, String)}.
     *
     * @throws PermissionDeniedException if the permission is not held
     */
    public void requirePermission(Principal principal, String permission) {
        if (!hasPermission(principal, permission)) {
            throw new PermissionDeniedException(principal == null ? null : principal.id(), permission);
        }
    }

    /**
     * Guard variant of {@link #hasPermission(AuthenticationResult, String)}.
     *
     * @throws PermissionDeniedException if the caller is not authenticated or lacks the permission
     */
    public void requirePermission(AuthenticationResult result, String permission) {
        requirePermission(result.authenticatedPrincipal().orElse(null), permission);
    }
}
