package com.wishmaster.wishlist.infrastructure.tokens;

import com.wishmaster.security.InMemoryRefreshTokenRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically drops expired refresh token ids of principals that never came back. */
@Component
public class RefreshTokenPurger {

    private static final Logger log = LoggerFactory.getLogger(RefreshTokenPurger.class);

    private final InMemoryRefreshTokenRegistry registry;

    public RefreshTokenPurger(InMemoryRefreshTokenRegistry registry) {
        this.registry = registry;
    }

    @Scheduled(
            fixedDelayString = "${wishmaster.tokens.purge-interval:PT10M}",
            initialDelayString = "${wishmaster.tokens.purge-interval:PT10M}")
    public void purge() {
        int removed = registry.purgeExpired();
        if (removed > 0) {
            log.debug("Purged {} principals without active refresh tokens", removed);
        }
    }
}
