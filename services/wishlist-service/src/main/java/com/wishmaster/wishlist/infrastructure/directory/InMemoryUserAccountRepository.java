package com.wishmaster.wishlist.infrastructure.directory;

import com.wishmaster.wishlist.domain.UserAccount;
import com.wishmaster.wishlist.domain.UserAccountRepository;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/** Process-local account store keyed by lower-cased email. */
@Repository
public class InMemoryUserAccountRepository implements UserAccountRepository {

    private final Map<String, UserAccount> accountsByEmail = new ConcurrentHashMap<>();

    @Override
    public Optional<UserAccount> findByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(accountsByEmail.get(key(email)));
    }

    @Override
    public void save(UserAccount account) {
        if (account == null) {
            throw new IllegalArgumentException("account must not be null");
        }
        UserAccount existing = accountsByEmail.putIfAbsent(key(account.email()), account);
        if (existing != null) {
            throw new IllegalArgumentException("Account already exists: " + account.email());
        }
    }

    private static String key(String email) {
        return email.strip().toLowerCase(Locale.ROOT);
    }
}
