package com.wishmaster.security;

import com.wishmaster.security.testing.TestTokens;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TokenCodec}: round trip, signature, expiry boundary and audience checks.
 */
@DisplayName("TokenCodec")
class TokenCodecTest {

    private static final Instant ISSUED = TestTokens.NOW;
    private static final Instant EXPIRES = ISSUED.plus(Duration.ofMinutes(15));

    private final TokenCodec codec = new TokenCodec(TestTokens.config(), TestTokens.fixedClock());

    private static TokenCodec codecAt(Instant instant) {
        return new TokenCodec(TestTokens.config(), TestTokens.clockAt(instant));
    }

    @Nested
    @DisplayName("round trip")
    class RoundTrip {

        @Test
        @DisplayName("returns the encoded claims unchanged")
        void claimsUnchanged() {
            Map<String, Object> claims = new LinkedHashMap<>();
            claims.put("id", "8b0d9a3e-6d2f-4a4e-9a54-0d8a1c6b1f10");
            claims.put("token_id", 7L);
            claims.put("name", "wish list owner");
            claims.put("large", 9_000_000_000L);
            claims.put("scopes", List.of("read", 2L));

            String token = codec.encode(claims, TokenAudience.REFRESH, EXPIRES);
            DecodedToken decoded = codec.decode(token, TokenAudience.REFRESH);

            assertThat(decoded.claims()).isEqualTo(claims);
        }

        @Test
        @DisplayName("decodes small integral claims as Long")
        void integralClaimsAsLong() {
            String token = codec.encode(
                    Map.of("token_id", 7L, "count", 3, "nested", Map.of("n", 1)), TokenAudience.ACCESS, EXPIRES);

            Map<String, Object> decoded = codec.decode(token, TokenAudience.ACCESS).claims();

            assertThat(decoded.get("token_id")).isInstanceOf(Long.class).isEqualTo(7L);
            assertThat(decoded.get("count")).isEqualTo(3L);
            assertThat(decoded.get("nested")).isEqualTo(Map.of("n", 1L));
        }

        @Test
        @DisplayName("exposes audience, issue and expiry instants")
        void exposesMetadata() {
            String token = codec.encode(Map.of("id", "x"), TokenAudience.ACCESS, EXPIRES);

            DecodedToken decoded = codec.decode(token, TokenAudience.ACCESS);

            assertThat(decoded.audience()).isEqualTo(TokenAudience.ACCESS);
            assertThat(decoded.issuedAt()).isEqualTo(ISSUED);
            assertThat(decoded.expiresAt()).isEqualTo(EXPIRES);
        }

        @Test
        @DisplayName("produces a URL-safe compact string")
        void urlSafe() {
            String token = codec.encode(Map.of("id", "x"), TokenAudience.ACCESS, EXPIRES);

            assertThat(token).matches("[A-Za-z0-9_\\-]+\\.[A-Za-z0-9_\\-]+\\.[A-Za-z0-9_\\-]+");
        }

        @Test
        @DisplayName("truncates expiry to whole seconds")
        void truncatesExpiry() {
            String token = codec.encode(Map.of("id", "x"), TokenAudience.ACCESS, EXPIRES.plusMillis(750));

            assertThat(codec.decode(token, TokenAudience.ACCESS).expiresAt()).isEqualTo(EXPIRES);
        }

        @Test
        @DisplayName("rejects reserved claim names")
        void rejectsReservedClaims() {
            assertThatThrownBy(() -> codec.encode(Map.of("aud", "refresh"), TokenAudience.ACCESS, EXPIRES))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("aud");
            assertThatThrownBy(() -> codec.encode(Map.of("exp", 1), TokenAudience.ACCESS, EXPIRES))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("expiry")
    class Expiry {

        @Test
        @DisplayName("accepts a token one second before expiry")
        void validJustBeforeExpiry() {
            String token = codec.encode(Map.of("id", "x"), TokenAudience.ACCESS, EXPIRES);

            assertThat(codecAt(EXPIRES.minusSeconds(1)).decode(token, TokenAudience.ACCESS).claims())
                    .containsEntry("id", "x");
        }

        @Test
        @DisplayName("rejects a token exactly at its expiry instant")
        void expiredAtBoundary() {
            String token = codec.encode(Map.of("id", "x"), TokenAudience.ACCESS, EXPIRES);

            assertThatThrownBy(() -> codecAt(EXPIRES).decode(token, TokenAudience.ACCESS))
                    .isInstanceOf(TokenExpiredException.class)
                    .satisfies(e -> assertThat(((TokenExpiredException) e).expiredAt()).isEqualTo(EXPIRES));
        }

        @Test
        @DisplayName("rejects a token within the expiry second")
        void expiredWithinBoundarySecond() {
            String token = codec.encode(Map.of("id", "x"), TokenAudience.ACCESS, EXPIRES);

            assertThatThrownBy(() -> codecAt(EXPIRES.plusMillis(400)).decode(token, TokenAudience.ACCESS))
                    .isInstanceOf(TokenExpiredException.class);
        }

        @Test
        @DisplayName("rejects a token long past expiry")
        void expiredLongAgo() {
            String token = codec.encode(Map.of("id", "x"), TokenAudience.ACCESS, EXPIRES);

            assertThatThrownBy(() -> codecAt(EXPIRES.plus(Duration.ofDays(3))).decode(token, TokenAudience.ACCESS))
                    .isInstanceOf(TokenExpiredException.class);
        }
    }

    @Nested
    @DisplayName("audience")
    class Audience {

        @Test
        @DisplayName("rejects an access token decoded as refresh")
        void accessAsRefresh() {
            String token = codec.encode(Map.of("id", "x"), TokenAudience.ACCESS, EXPIRES);

            assertThatThrownBy(() -> codec.decode(token, TokenAudience.REFRESH))
                    .isInstanceOf(AudienceMismatchException.class)
                    .satisfies(e -> {
                        var mismatch = (AudienceMismatchException) e;
                        assertThat(mismatch.expected()).isEqualTo(TokenAudience.REFRESH);
                        assertThat(mismatch.actual()).isEqualTo("access");
                    });
        }

        @Test
        @DisplayName("rejects a refresh token decoded as access")
        void refreshAsAccess() {
            String token = codec.encode(Map.of("id", "x"), TokenAudience.REFRESH, EXPIRES);

            assertThatThrownBy(() -> codec.decode(token, TokenAudience.ACCESS))
                    .isInstanceOf(AudienceMismatchException.class);
        }
    }

    @Nested
    @DisplayName("signature")
    class Signature {

        @Test
        @DisplayName("rejects a token signed with another key")
        void foreignKey() {
            var foreign = new TokenCodec(
                    TokensConfig.of("another-secret-key-of-at-least-32-bytes!!", Duration.ofMinutes(5)),
                    TestTokens.fixedClock());
            String token = foreign.encode(Map.of("id", "x"), TokenAudience.ACCESS, EXPIRES);

            assertThatThrownBy(() -> codec.decode(token, TokenAudience.ACCESS))
                    .isInstanceOf(InvalidSignatureException.class);
        }

        @Test
        @DisplayName("rejects a token whose payload was altered")
        void tamperedPayload() {
            String token = codec.encode(Map.of("id", "alice"), TokenAudience.ACCESS, EXPIRES);
            String[] parts = token.split("\\.");
            String forged = Base64.getUrlEncoder().withoutPadding().encodeToString(
                    "{\"id\":\"mallory\",\"aud\":\"access\",\"exp\":4102444800}".getBytes(StandardCharsets.UTF_8));

            String tampered = parts[0] + "." + forged + "." + parts[2];

            assertThatThrownBy(() -> codec.decode(tampered, TokenAudience.ACCESS))
                    .isInstanceOf(InvalidSignatureException.class);
        }

        @Test
        @DisplayName("reports signature failure before expiry")
        void signatureCheckedFirst() {
            var foreign = new TokenCodec(
                    TokensConfig.of("another-secret-key-of-at-least-32-bytes!!", Duration.ofMinutes(5)),
                    TestTokens.fixedClock());
            String token = foreign.encode(Map.of("id", "x"), TokenAudience.ACCESS, EXPIRES);

            assertThatThrownBy(() -> codecAt(EXPIRES.plusSeconds(60)).decode(token, TokenAudience.ACCESS))
                    .isInstanceOf(InvalidSignatureException.class);
        }

        @Test
        @DisplayName("rejects garbage, empty and null input")
        void garbage() {
            assertThatThrownBy(() -> codec.decode("not-a-token", TokenAudience.ACCESS))
                    .isInstanceOf(InvalidSignatureException.class);
            assertThatThrownBy(() -> codec.decode("", TokenAudience.ACCESS))
                    .isInstanceOf(InvalidSignatureException.class);
            assertThatThrownBy(() -> codec.decode(null, TokenAudience.ACCESS))
                    .isInstanceOf(InvalidSignatureException.class);
        }

        @Test
        @DisplayName("rejects an unsigned token")
        void unsigned() {
            Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
            String header = encoder.encodeToString("{\"alg\":\"none\"}".getBytes(StandardCharsets.UTF_8));
            String payload = encoder.encodeToString(
                    "{\"id\":\"x\",\"aud\":\"access\",\"exp\":4102444800}".getBytes(StandardCharsets.UTF_8));

            assertThatThrownBy(() -> codec.decode(header + "." + payload + ".", TokenAudience.ACCESS))
                    .isInstanceOf(InvalidSignatureException.class);
        }
    }
}
