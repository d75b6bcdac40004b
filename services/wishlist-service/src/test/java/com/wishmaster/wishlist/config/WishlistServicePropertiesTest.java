package com.wishmaster.wishlist.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for the compact-constructor defaults of {@link WishlistServiceProperties}. */
@DisplayName("WishlistServiceProperties")
class WishlistServicePropertiesTest {

    @Test
    @DisplayName("accepts valid properties")
    void acceptsValidProperties() {
        var props = new WishlistServiceProperties(
                "wishlist-service", "production", "Wishlists", List.of("https://wishmaster.example"));

        assertThat(props.name()).isEqualTo("wishlist-service");
        assertThat(props.environment()).isEqualTo("production");
        assertThat(props.description()).isEqualTo("Wishlists");
        assertThat(props.corsAllowedOrigins()).containsExactly("https://wishmaster.example");
    }

    @Test
    @DisplayName("defaults environment to 'development' and description to empty")
    void defaultsOptionalFields() {
        var props = new WishlistServiceProperties("wishlist-service", null, null, null);

        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.description()).isEmpty();
    }

    @Test
    @DisplayName("defaults CORS origins to the local dev servers")
    void defaultsCorsOrigins() {
        var props = new WishlistServiceProperties("wishlist-service", "dev", null, List.of());

        assertThat(props.corsAllowedOrigins()).isEqualTo(WishlistServiceProperties.DEFAULT_CORS_ORIGINS);
    }
}
