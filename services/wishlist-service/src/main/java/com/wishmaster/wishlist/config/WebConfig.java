package com.wishmaster.wishlist.config;

import com.wishmaster.wishlist.infrastructure.web.AuthenticationResultArgumentResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS for browser clients and injection of the request's
 * {@link com.wishmaster.security.AuthenticationResult} into controller methods.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final WishlistServiceProperties properties;

    public WebConfig(WishlistServiceProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(properties.corsAllowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders(HttpHeaders.WWW_AUTHENTICATE, "X-Correlation-ID")
                .allowCredentials(true)
                .maxAge(3600);
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new AuthenticationResultArgumentResolver());
    }
}
