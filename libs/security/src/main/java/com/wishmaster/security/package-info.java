/**
 * Authentication and authorization core of Wishmaster.
 * <p>
 * {@link com.wishmaster.security.TokenCodec} signs and verifies tokens,
 * {@link com.wishmaster.security.TokensManager} issues and decodes typed access/refresh claims,
 * {@link com.wishmaster.security.BearerTokenAuthenticator} turns an Authorization header into an
 * {@link com.wishmaster.security.AuthenticationResult}, and
 * {@link com.wishmaster.security.AuthorizationManager} resolves group → role → permission chains.
 * Persistence is reached only through the read-only ports
 * {@link com.wishmaster.security.PrincipalDirectory} and
 * {@link com.wishmaster.security.AuthorizationRepository}.
 */
package com.wishmaster.security;
