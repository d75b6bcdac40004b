package com.wishmaster.security;

/**
 * Named collection of roles. Principals belong to groups.
 *
 * @param name the unique name
 */
public record Group(String name) {

    public Group {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("group name must not be null or blank");
        }
    }
}
