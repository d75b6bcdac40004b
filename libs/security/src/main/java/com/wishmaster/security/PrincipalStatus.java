package com.wishmaster.security;

/**
 * Lifecycle status of a principal. Only {@link #CONFIRMED} principals may authenticate,
 * log in, or refresh tokens.
 */
public enum PrincipalStatus {

    UNCONFIRMED,
    CONFIRMED,
    ARCHIVED;

    /** Whether a principal in this status may hold valid credentials. */
    public boolean canAuthenticate() {
        return this == CONFIRMED;
    }
}
