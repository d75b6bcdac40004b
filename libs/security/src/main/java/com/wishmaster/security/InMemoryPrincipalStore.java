package com.wishmaster.security;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory {@link PrincipalDirectory} and {@link AuthorizationRepository}.
 * <p>
 * Backs unit tests and local runs where no database is wired. Every read returns an
 * immutable snapshot, so callers never observe later mutations through a returned set.
 */
public class InMemoryPrincipalStore implements PrincipalDirectory, AuthorizationRepository {

    private final Map<UUID, PrincipalStatus> statuses = new ConcurrentHashMap<>();
    private final Map<UUID, Set<Group>> memberships = new ConcurrentHashMap<>();
    private final Map<Group, Set<Role>> groupRoles = new ConcurrentHashMap<>();
    private final Map<Role, Set<Permission>> rolePermissions = new ConcurrentHashMap<>();

    /** Creates or updates a principal's status. */
    public void savePrincipal(UUID id, PrincipalStatus status) {
        if (id == null || status == null) {
            throw new IllegalArgumentException("id and status must not be null");
        }
        statuses.put(id, status);
    }

    /** Removes a principal and its memberships. */
    public void deletePrincipal(UUID id) {
        statuses.remove(id);
        memberships.remove(id);
    }

    public void addToGroup(UUID principalId, Group group) {
        memberships.computeIfAbsent(principalId, id -> ConcurrentHashMap.newKeySet()).add(group);
    }

    public void removeFromGroup(UUID principalId, Group group) {
        Set<Group> groups = memberships.get(principalId);
        if (groups != null) {
            groups.remove(group);
        }
    }

    public void grantRole(Group group, Role role) {
        groupRoles.computeIfAbsent(group, g -> ConcurrentHashMap.newKeySet()).add(role);
    }

    public void grantPermission(Role role, Permission permission) {
        rolePermissions.computeIfAbsent(role, r -> ConcurrentHashMap.newKeySet()).add(permission);
    }

    @Override
    public Optional<Principal> findPrincipalById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        PrincipalStatus status = statuses.get(id);
        if (status == null) {
            return Optional.empty();
        }
        return Optional.of(new Principal(id, status, findGroupsFor(id)));
    }

    @Override
    public Set<Group> findGroupsFor(UUID principalId) {
        return snapshot(memberships, principalId);
    }

    @Override
    public Set<Role> findRolesFor(Group group) {
        return snapshot(groupRoles, group);
    }

    @Override
    public Set<Permission> findPermissionsFor(Role role) {
        return snapshot(rolePermissions, role);
    }

    private static <K, T> Set<T> snapshot(Map<K, Set<T>> index, K key) {
        if (key == null) {
            return Set.of();
        }
        Set<T> values = index.get(key);
        return values == null ? Set.of() : Set.copyOf(values);
    }
}
