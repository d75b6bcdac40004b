package com.wishmaster.wishlist.api;

import com.wishmaster.security.PrincipalStatus;
import java.util.List;
import java.util.UUID;

/**
 * The authenticated caller as returned by {@code GET /api/v1/users/me}.
 *
 * @param id principal id
 * @param status lifecycle status
 * @param groups group names, sorted
 * @param permissions effective permission names, sorted
 */
public record PrincipalView(UUID id, PrincipalStatus status, List<String> groups, List<String> permissions) {}
