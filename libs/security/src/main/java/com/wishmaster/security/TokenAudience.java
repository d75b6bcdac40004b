package com.wishmaster.security;

/**
 * Audience tag carried by every token, restricting which operation may consume it.
 * <p>
 * The wire value is written to the JWT {@code aud} claim. A token is only accepted by an
 * operation that expects exactly its audience; an access token is never usable for a refresh
 * and vice versa.
 */
public enum TokenAudience {

    ACCESS("access"),
    REFRESH("refresh");

    private final String value;

    TokenAudience(String value) {
        this.value = value;
    }

    /** The value written to the {@code aud} claim (e.g., "access"). */
    public String value() {
        return value;
    }
}
