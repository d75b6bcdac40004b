package com.wishmaster.security;

/**
 * Base type of every failure raised while verifying or interpreting a token.
 * <p>
 * Subclasses identify the exact failure so callers can map it to a response; nothing in the
 * security core converts a {@code TokenException} into a silent "not authenticated".
 */
public abstract class TokenException extends RuntimeException {

    protected TokenException(String message) {
        super(message);
    }

    protected TokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
