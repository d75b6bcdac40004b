package com.wishmaster.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Signs and verifies compact JWS tokens (HS256) carrying caller claims plus an audience.
 * <p>
 * The codec is stateless apart from the signing key and clock, and safe for concurrent use.
 * Verification runs in a fixed order: signature, then expiry, then audience, so a tampered
 * token is always reported as {@link InvalidSignatureException} even if it is also expired.
 * <p>
 * All timestamps are whole seconds (JWT NumericDate). The validity window is
 * {@code [iat, exp)}: at the expiry second the token is already expired.
 * <p>
 * Integral claim values are carried as {@link Long} on both sides, including inside nested
 * maps and lists, so a decoded claim map equals the one that was encoded.
 */
public final class TokenCodec {

    private static final Set<String> REGISTERED_CLAIMS =
            Set.of(Claims.AUDIENCE, Claims.ISSUED_AT, Claims.EXPIRATION);

    private final SecretKey key;
    private final Clock clock;
    private final JwtParser parser;

    public TokenCodec(TokensConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.key = Keys.hmacShaKeyFor(config.secretKeyBytes());
        this.clock = clock;
        this.parser = Jwts.parserBuilder()
                .setSigningKey(key)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    /**
     * Encodes claims into a signed token.
     *
     * @param claims    caller claims; must not use the registered names {@code aud}, {@code iat}, {@code exp}
     * @param audience  the single audience of the token
     * @param expiresAt expiry instant, truncated to whole seconds
     * @return URL-safe compact JWS string
     */
    public String encode(Map<String, ?> claims, TokenAudience audience, Instant expiresAt) {
        if (claims == null) {
            throw new IllegalArgumentException("claims must not be null");
        }
        if (audience == null) {
            throw new IllegalArgumentException("audience must not be null");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("expiresAt must not be null");
        }
        for (String name : claims.keySet()) {
            if (REGISTERED_CLAIMS.contains(name)) {
                throw new IllegalArgumentException("claim '%s' is reserved".formatted(name));
            }
        }

        return Jwts.builder()
                .setClaims(normalize(claims))
                .setAudience(audience.value())
                .setIssuedAt(Date.from(now()))
                .setExpiration(Date.from(expiresAt.truncatedTo(ChronoUnit.SECONDS)))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * Verifies a token and returns its claims.
     *
     * @param token            compact JWS string
     * @param expectedAudience audience the consuming operation requires
     * @return the verified token
     * @throws InvalidSignatureException if the token is tampered, foreign-signed, unsigned or malformed
     * @throws TokenExpiredException     if the current second is at or past the expiry
     * @throws AudienceMismatchException if the token's audience differs from {@code expectedAudience}
     * @throws MalformedClaimsException  if the token carries no expiry
     */
    public DecodedToken decode(String token, TokenAudience expectedAudience) {
        if (expectedAudience == null) {
            throw new IllegalArgumentException("expectedAudience must not be null");
        }

        Claims body;
        try {
            body = parser.parseClaimsJws(token).getBody();
        } catch (ExpiredJwtException e) {
            throw new TokenExpiredException(toInstant(e.getClaims().getExpiration()), e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidSignatureException("Token could not be verified", e);
        }

        Instant expiresAt = toInstant(body.getExpiration());
        if (expiresAt == null) {
            throw new MalformedClaimsException("Token carries no expiry");
        }
        // The parser only rejects tokens strictly past exp; the expiry second itself is invalid too.
        if (!now().isBefore(expiresAt)) {
            throw new TokenExpiredException(expiresAt);
        }

        String audience = body.getAudience();
        if (!expectedAudience.value().equals(audience)) {
            throw new AudienceMismatchException(expectedAudience, audience);
        }

        Map<String, Object> claims = normalize(body);
        claims.keySet().removeAll(REGISTERED_CLAIMS);
        return new DecodedToken(
                Collections.unmodifiableMap(claims),
                expectedAudience,
                toInstant(body.getIssuedAt()),
                expiresAt);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private static Map<String, Object> normalize(Map<String, ?> claims) {
        Map<String, Object> result = new LinkedHashMap<>(claims.size());
        claims.forEach((name, value) -> result.put(name, normalizeValue(value)));
        return result;
    }

    private static Object normalizeValue(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> nested = new LinkedHashMap<>(map.size());
            map.forEach((key, item) -> nested.put(key, normalizeValue(item)));
            return nested;
        }
        if (value instanceof List<?> list) {
            List<Object> nested = new ArrayList<>(list.size());
            list.forEach(item -> nested.add(normalizeValue(item)));
            return nested;
        }
        return value;
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }
}
