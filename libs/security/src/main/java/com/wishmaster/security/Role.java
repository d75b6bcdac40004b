package com.wishmaster.security;

/**
 * Named collection of permissions, granted to groups.
 *
 * @param name the unique name
 */
public record Role(String name) {

    public Role {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("role name must not be null or blank");
        }
    }
}
