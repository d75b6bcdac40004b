package com.wishmaster.security;

/**
 * Why an authentication attempt ended in rejection.
 */
public enum RejectionReason {

    /** The scheme matched but no token followed it. */
    MISSING_TOKEN,
    /** Signature, structure or claim shape invalid. */
    INVALID_TOKEN,
    EXPIRED_TOKEN,
    /** A non-access token was presented as a bearer token. */
    WRONG_AUDIENCE,
    /** The token names a principal that does not exist. */
    UNKNOWN_PRINCIPAL,
    /** The principal exists but is not CONFIRMED. */
    INACTIVE_PRINCIPAL,
    /** The request carried no credentials, but the operation requires them. */
    NOT_AUTHENTICATED
}
