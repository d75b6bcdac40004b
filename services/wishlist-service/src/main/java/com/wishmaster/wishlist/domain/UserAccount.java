package com.wishmaster.wishlist.domain;

import java.util.UUID;

/**
 * Login credentials of a principal.
 *
 * @param email login name
 * @param passwordHash BCrypt hash of the password
 * @param principalId the principal this account authenticates as
 */
public record UserAccount(String email, String passwordHash, UUID principalId) {

    public UserAccount {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email must not be null or blank");
        }
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new IllegalArgumentException("passwordHash must not be null or blank");
        }
        if (principalId == null) {
            throw new IllegalArgumentException("principalId must not be null");
        }
    }

    @Override
    public String toString() {
        return "UserAccount[email=%s, passwordHash=***, principalId=%s]".formatted(email, principalId);
    }
}
