package com.wishmaster.wishlist.config;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service-level settings bound from {@code wishmaster.service.*}.
 *
 * <pre>
 * wishmaster:
 *   service:
 *     name: wishlist-service
 *     environment: production
 *     cors-allowed-origins: https://wishmaster.example
 * </pre>
 *
 * @param name service name used for logging and the {@code service} metric tag. Required.
 * @param environment deployment environment (development, staging, production)
 * @param description human-readable description returned by {@code /api/v1/info}
 * @param corsAllowedOrigins browser origins allowed to call {@code /api/**}
 */
@ConfigurationProperties(prefix = "wishmaster.service")
@Validated
public record WishlistServiceProperties(
        @NotBlank String name,
        String environment,
        String description,
        List<String> corsAllowedOrigins) {

    /** Origins of the local frontend dev servers. */
    public static final List<String> DEFAULT_CORS_ORIGINS =
            List.of("http://localhost:3000", "http://localhost:5173");

    /** Compact constructor: applies defaults before Bean Validation runs. */
    public WishlistServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (description == null) {
            description = "";
        }
        corsAllowedOrigins =
                corsAllowedOrigins == null || corsAllowedOrigins.isEmpty()
                        ? DEFAULT_CORS_ORIGINS
                        : List.copyOf(corsAllowedOrigins);
    }
}
