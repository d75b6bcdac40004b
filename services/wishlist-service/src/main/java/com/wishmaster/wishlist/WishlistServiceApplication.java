package com.wishmaster.wishlist;

import com.wishmaster.wishlist.config.DirectoryProperties;
import com.wishmaster.wishlist.config.TokensProperties;
import com.wishmaster.wishlist.config.WishlistServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Wishlist service: exposes token issuance, refresh and permission checks over HTTP.
 *
 * <p>Wires the {@code wishmaster-security} core into Spring MVC:
 *
 * <ul>
 *   <li>{@code POST/PUT/DELETE /api/v1/tokens} for login, refresh and logout
 *   <li>bearer authentication on every request via a servlet filter
 *   <li>correlation ID propagation into SLF4J MDC
 *   <li>RFC 7807 ProblemDetail error responses
 *   <li>Actuator health, metrics and Prometheus endpoints
 *   <li>scheduled purge of expired refresh token ids
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({
    WishlistServiceProperties.class,
    TokensProperties.class,
    DirectoryProperties.class
})
public class WishlistServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(WishlistServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(WishlistServiceApplication.class, args);
        log.info("Wishlist service started successfully");
    }
}
