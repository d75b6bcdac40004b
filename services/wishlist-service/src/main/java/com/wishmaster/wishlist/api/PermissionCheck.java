package com.wishmaster.wishlist.api;

/** Answer of {@code GET /api/v1/permissions/{name}} for the calling principal. */
public record PermissionCheck(String permission, boolean granted) {}
