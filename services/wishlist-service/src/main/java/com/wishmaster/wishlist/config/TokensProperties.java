package com.wishmaster.wishlist.config;

import com.wishmaster.security.TokensConfig;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token settings bound from {@code wishmaster.tokens.*}.
 *
 * <pre>
 * wishmaster:
 *   tokens:
 *     secret-key: ${WISHMASTER_TOKENS_SECRET_KEY}
 *     access-lifetime: 15m
 *     refresh-lifetime: 7d
 * </pre>
 *
 * <p>The secret has no default: a service without one fails at startup.
 *
 * @param secretKey HMAC-SHA256 signing secret, at least 32 bytes
 * @param accessLifetime lifetime of access tokens (default 15 minutes)
 * @param refreshLifetime lifetime of refresh tokens (default 7 days)
 */
@ConfigurationProperties(prefix = "wishmaster.tokens")
@Validated
public record TokensProperties(
        @NotBlank String secretKey, Duration accessLifetime, Duration refreshLifetime) {

    public static final Duration DEFAULT_ACCESS_LIFETIME = Duration.ofMinutes(15);
    public static final Duration DEFAULT_REFRESH_LIFETIME = Duration.ofDays(7);

    public TokensProperties {
        if (accessLifetime == null) {
            accessLifetime = DEFAULT_ACCESS_LIFETIME;
        }
        if (refreshLifetime == null) {
            refreshLifetime = DEFAULT_REFRESH_LIFETIME;
        }
    }

    /** Builds the validated core configuration. */
    public TokensConfig toTokensConfig() {
        return new TokensConfig(secretKey, accessLifetime, refreshLifetime);
    }

    @Override
    public String toString() {
        return "TokensProperties[secretKey=***, accessLifetime=%s, refreshLifetime=%s]"
                .formatted(accessLifetime, refreshLifetime);
    }
}
