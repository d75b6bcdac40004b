package com.wishmaster.security;

import java.util.UUID;

/**
 * Typed payload of a decoded token. The variant is chosen by the token's audience:
 * {@link AccessClaims} for {@link TokenAudience#ACCESS}, {@link RefreshClaims} for
 * {@link TokenAudience#REFRESH}.
 */
public sealed interface TokenClaims permits AccessClaims, RefreshClaims {

    /** The principal the token was issued to. */
    UUID principalId();

    /** The audience this claim shape belongs to. */
    TokenAudience audience();
}
