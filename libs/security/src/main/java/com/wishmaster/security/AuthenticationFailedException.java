package com.wishmaster.security;

/**
 * Terminal rejection of the caller's credentials.
 * <p>
 * The message is deliberately generic and safe to return to clients; the precise
 * {@link #reason()} is for server-side logging and metrics.
 */
public class AuthenticationFailedException extends RuntimeException {

    public static final String MESSAGE = "Could not validate credentials.";

    private final RejectionReason reason;

    public AuthenticationFailedException(RejectionReason reason) {
        super(MESSAGE);
        this.reason = reason;
    }

    public RejectionReason reason() {
        return reason;
    }
}
