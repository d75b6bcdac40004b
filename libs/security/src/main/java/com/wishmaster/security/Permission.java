package com.wishmaster.security;

/**
 * Atomic named capability, e.g. {@code wish:create}. Names are matched exactly and case-sensitively.
 *
 * @param name the unique name
 */
public record Permission(String name) {

    public Permission {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("permission name must not be null or blank");
        }
    }
}
