package com.wishmaster.wishlist.api;

import com.wishmaster.security.TokensConfig;
import com.wishmaster.wishlist.config.WishlistServiceProperties;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Public service info, including the configured token lifetimes in seconds. */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final WishlistServiceProperties properties;
    private final TokensConfig tokensConfig;

    public ServiceInfoController(WishlistServiceProperties properties, TokensConfig tokensConfig) {
        this.properties = properties;
        this.tokensConfig = tokensConfig;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description(),
                "accessTokenLifetimeSeconds", tokensConfig.defaultLifetime().toSeconds(),
                "refreshTokenLifetimeSeconds", tokensConfig.refreshLifetime().toSeconds(),
                "status", "running",
                "timestamp", Instant.now().toString());
    }
}
