package com.wishmaster.wishlist.domain;

import java.util.Optional;

/** Lookup of login accounts. Emails match ignoring case. */
public interface UserAccountRepository {

    Optional<UserAccount> findByEmail(String email);

    /**
     * Stores a new account.
     *
     * @throws IllegalArgumentException if an account with the same email exists
     */
    void save(UserAccount account);
}
