package com.wishmaster.security;

import java.time.Instant;

/**
 * The token was authentic but its validity window has closed. A token whose expiry equals
 * the current second is already expired.
 */
public class TokenExpiredException extends TokenException {

    private final Instant expiredAt;

    public TokenExpiredException(Instant expiredAt) {
        this(expiredAt, null);
    }

    public TokenExpiredException(Instant expiredAt, Throwable cause) {
        super("Token expired at " + expiredAt, cause);
        this.expiredAt = expiredAt;
    }

    public Instant expiredAt() {
        return expiredAt;
    }
}
