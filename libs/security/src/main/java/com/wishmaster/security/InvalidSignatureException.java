package com.wishmaster.security;

/**
 * The token could not be verified: tampered bytes, a foreign signing key, an unsigned or
 * structurally malformed token.
 */
public class InvalidSignatureException extends TokenException {

    public InvalidSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
