package com.wishmaster.security;

import java.time.Instant;
import java.util.Map;

/**
 * A verified token as returned by {@link TokenCodec#decode(String, TokenAudience)}.
 *
 * @param claims    the caller-supplied claims, with the registered {@code aud}/{@code iat}/{@code exp} removed
 * @param audience  the audience the token was issued for
 * @param issuedAt  issue instant (second precision, nullable if the token carried none)
 * @param expiresAt expiry instant (second precision)
 */
public record DecodedToken(
        Map<String, Object> claims,
        TokenAudience audience,
        Instant issuedAt,
        Instant expiresAt
) {
}
