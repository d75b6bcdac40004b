package com.wishmaster.security;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Process-wide token configuration, built once at startup and injected into the
 * {@link TokenCodec}, {@link TokensManager} and {@link TokenPairIssuer}.
 * <p>
 * The secret signs tokens with HMAC-SHA256 and must therefore be at least 256 bits
 * (32 bytes of UTF-8). A missing refresh lifetime falls back to the default lifetime.
 *
 * @param secretKey       HMAC signing secret
 * @param defaultLifetime lifetime of access tokens and of any token created without an explicit lifetime
 * @param refreshLifetime lifetime of refresh tokens
 */
public record TokensConfig(String secretKey, Duration defaultLifetime, Duration refreshLifetime) {

    /** Minimum secret length in bytes for HS256. */
    public static final int MIN_SECRET_BYTES = 32;

    public TokensConfig {
        if (secretKey == null || secretKey.isBlank()) {
            throw new IllegalArgumentException("secretKey must not be null or blank");
        }
        if (secretKey.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                    "secretKey must be at least %d bytes for HS256".formatted(MIN_SECRET_BYTES));
        }
        requirePositive(defaultLifetime, "defaultLifetime");
        if (refreshLifetime == null) {
            refreshLifetime = defaultLifetime;
        }
        requirePositive(refreshLifetime, "refreshLifetime");
    }

    /**
     * Creates a config where access and refresh tokens share one lifetime.
     */
    public static TokensConfig of(String secretKey, Duration defaultLifetime) {
        return new TokensConfig(secretKey, defaultLifetime, null);
    }

    /** Raw key material for the HMAC key. */
    public byte[] secretKeyBytes() {
        return secretKey.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "TokensConfig[secretKey=***, defaultLifetime=%s, refreshLifetime=%s]"
                .formatted(defaultLifetime, refreshLifetime);
    }

    private static void requirePositive(Duration lifetime, String name) {
        if (lifetime == null || lifetime.isZero() || lifetime.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
