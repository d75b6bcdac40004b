package com.wishmaster.security;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Issues and validates access/refresh tokens on top of a {@link TokenCodec}.
 * <p>
 * Every {@code createCode} call is an independent signing operation; nothing is memoized, so
 * issuing a pair always performs two signings. Decoding turns the raw claim map into the
 * typed {@link TokenClaims} variant selected by the audience, rejecting any other shape.
 */
public class TokensManager {

    /** Claim holding the principal id (UUID string). */
    public static final String CLAIM_PRINCIPAL_ID = "id";

    /** Claim holding the refresh token id (integer). */
    public static final String CLAIM_TOKEN_ID = "token_id";

    private static final Set<String> ACCESS_SHAPE = Set.of(CLAIM_PRINCIPAL_ID);
    private static final Set<String> REFRESH_SHAPE = Set.of(CLAIM_PRINCIPAL_ID, CLAIM_TOKEN_ID);

    private final TokenCodec codec;
    private final TokensConfig config;
    private final Clock clock;

    public TokensManager(TokenCodec codec, TokensConfig config, Clock clock) {
        if (codec == null || config == null || clock == null) {
            throw new IllegalArgumentException("codec, config and clock must not be null");
        }
        this.codec = codec;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Creates a token with the default lifetime.
     */
    public String createCode(Map<String, ?> data, TokenAudience audience) {
        return createCode(data, audience, config.defaultLifetime());
    }

    /**
     * Creates a token valid from now until now + {@code lifetime}.
     *
     * @param data     claims to embed
     * @param audience audience of the token
     * @param lifetime validity duration
     * @return the signed token
     */
    public String createCode(Map<String, ?> data, TokenAudience audience, Duration lifetime) {
        if (lifetime == null || lifetime.isNegative() || lifetime.isZero()) {
            throw new IllegalArgumentException("lifetime must be a positive duration");
        }
        return codec.encode(data, audience, expiryFor(lifetime));
    }

    /**
     * Issues an access/refresh pair for a principal.
     *
     * @param principalId the principal
     * @param tokenId     refresh token id registered for rotation
     * @return ACCESS token with {@code {id}} and REFRESH token with {@code {id, token_id}}
     */
    public TokenPair createPair(UUID principalId, long tokenId) {
        if (principalId == null) {
            throw new IllegalArgumentException("principalId must not be null");
        }
        String id = principalId.toString();
        String accessToken = createCode(
                Map.of(CLAIM_PRINCIPAL_ID, id),
                TokenAudience.ACCESS,
                config.defaultLifetime());
        String refreshToken = createCode(
                Map.of(CLAIM_PRINCIPAL_ID, id, CLAIM_TOKEN_ID, tokenId),
                TokenAudience.REFRESH,
                config.refreshLifetime());
        return new TokenPair(accessToken, refreshToken);
    }

    /**
     * Verifies a token for the expected audience and parses its claims.
     *
     * @throws TokenException for any verification or shape failure
     */
    public TokenClaims decodeCode(String token, TokenAudience expectedAudience) {
        DecodedToken decoded = codec.decode(token, expectedAudience);
        Map<String, Object> claims = decoded.claims();
        return switch (decoded.audience()) {
            case ACCESS -> {
                requireShape(claims, ACCESS_SHAPE, decoded.audience());
                yield new AccessClaims(principalId(claims));
            }
            case REFRESH -> {
                requireShape(claims, REFRESH_SHAPE, decoded.audience());
                yield new RefreshClaims(principalId(claims), tokenId(claims));
            }
        };
    }

    /** Decodes an ACCESS token. */
    public AccessClaims decodeAccess(String token) {
        return (AccessClaims) decodeCode(token, TokenAudience.ACCESS);
    }

    /** Decodes a REFRESH token. */
    public RefreshClaims decodeRefresh(String token) {
        return (RefreshClaims) decodeCode(token, TokenAudience.REFRESH);
    }

    /**
     * Expiry a token created now with the given lifetime would carry.
     */
    public Instant expiryFor(Duration lifetime) {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS).plus(lifetime);
    }

    /** The configuration this manager issues tokens with. */
    public TokensConfig config() {
        return config;
    }

    private static void requireShape(Map<String, Object> claims, Set<String> shape, TokenAudience audience) {
        if (!claims.keySet().equals(shape)) {
            throw new MalformedClaimsException(
                    "Unexpected claims %s for %s token".formatted(claims.keySet(), audience.value()));
        }
    }

    private static UUID principalId(Map<String, Object> claims) {
        Object value = claims.get(CLAIM_PRINCIPAL_ID);
        if (!(value instanceof String text)) {
            throw new MalformedClaimsException("Claim '%s' must be a string".formatted(CLAIM_PRINCIPAL_ID));
        }
        try {
            return UUID.fromString(text);
        } catch (IllegalArgumentException e) {
            throw new MalformedClaimsException("Claim '%s' is not a UUID".formatted(CLAIM_PRINCIPAL_ID), e);
        }
    }

    private static long tokenId(Map<String, Object> claims) {
        Object value = claims.get(CLAIM_TOKEN_ID);
        if (value instanceof Long id) {
            return id;
        }
        throw new MalformedClaimsException("Claim '%s' must be an integer".formatted(CLAIM_TOKEN_ID));
    }
}
