package com.wishmaster.security;

/**
 * The token verified, but its claims do not match the shape required by its audience.
 */
public class MalformedClaimsException extends TokenException {

    public MalformedClaimsException(String message) {
        super(message);
    }

    public MalformedClaimsException(String message, Throwable cause) {
        super(message, cause);
    }
}
