package com.wishmaster.wishlist.config;

import com.wishmaster.observability.MetricFactory;
import com.wishmaster.security.AuthorizationManager;
import com.wishmaster.security.BearerTokenAuthenticator;
import com.wishmaster.security.InMemoryPrincipalStore;
import com.wishmaster.security.InMemoryRefreshTokenRegistry;
import com.wishmaster.security.RefreshTokenRegistry;
import com.wishmaster.security.TokenCodec;
import com.wishmaster.security.TokenPairIssuer;
import com.wishmaster.security.TokensConfig;
import com.wishmaster.security.TokensManager;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Wires the token and authorization core as singletons.
 *
 * <p>{@link TokensConfig} is built once from {@link TokensProperties}; an invalid secret or
 * lifetime aborts startup. The in-memory principal store serves as both the principal directory
 * and the authorization repository.
 */
@Configuration
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokensConfig tokensConfig(TokensProperties properties) {
        TokensConfig config = properties.toTokensConfig();
        log.info("Token configuration loaded: {}", config);
        return config;
    }

    @Bean
    public TokenCodec tokenCodec(TokensConfig config, Clock clock) {
        return new TokenCodec(config, clock);
    }

    @Bean
    public TokensManager tokensManager(TokenCodec codec, TokensConfig config, Clock clock) {
        return new TokensManager(codec, config, clock);
    }

    @Bean
    public InMemoryPrincipalStore principalStore() {
        return new InMemoryPrincipalStore();
    }

    @Bean
    public InMemoryRefreshTokenRegistry refreshTokenRegistry(Clock clock) {
        return new InMemoryRefreshTokenRegistry(clock);
    }

    @Bean
    public TokenPairIssuer tokenPairIssuer(
            TokensManager tokensManager,
            InMemoryPrincipalStore principalStore,
            RefreshTokenRegistry refreshTokenRegistry) {
        return new TokenPairIssuer(tokensManager, principalStore, refreshTokenRegistry);
    }

    @Bean
    public BearerTokenAuthenticator bearerTokenAuthenticator(
            TokensManager tokensManager, InMemoryPrincipalStore principalStore) {
        return new BearerTokenAuthenticator(tokensManager, principalStore);
    }

    @Bean
    public AuthorizationManager authorizationManager(InMemoryPrincipalStore principalStore) {
        return new AuthorizationManager(principalStore);
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, WishlistServiceProperties properties) {
        return new MetricFactory(registry, properties.name());
    }
}
