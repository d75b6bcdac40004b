package com.wishmaster.wishlist.domain;

/**
 * Login failed. Unknown email, wrong password and inactive account all raise this same
 * exception so callers cannot tell which accounts exist.
 */
public class InvalidCredentialsException extends RuntimeException {

    public static final String MESSAGE = "Invalid credentials.";

    public InvalidCredentialsException() {
        super(MESSAGE);
    }
}
