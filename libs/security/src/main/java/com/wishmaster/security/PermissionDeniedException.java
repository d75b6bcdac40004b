package com.wishmaster.security;

import java.util.Optional;
import java.util.UUID;

/**
 * The caller lacks a required permission. Anonymous callers are denied with an empty
 * {@link #principalId()}.
 */
public class PermissionDeniedException extends RuntimeException {

    private final UUID principalId;
    private final String permission;

    public PermissionDeniedException(UUID principalId, String permission) {
        super("Permission '%s' denied".formatted(permission));
        this.principalId = principalId;
        this.permission = permission;
    }

    public Optional<UUID> principalId() {
        return Optional.ofNullable(principalId);
    }

    public String permission() {
        return permission;
    }
}
