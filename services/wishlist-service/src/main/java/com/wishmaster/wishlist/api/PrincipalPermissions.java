package com.wishmaster.wishlist.api;

import java.util.List;
import java.util.UUID;

/** Effective permissions of a principal, sorted by name. */
public record PrincipalPermissions(UUID principalId, List<String> permissions) {}
