package com.wishmaster.security;

import com.wishmaster.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Per-request authenticator for {@code Authorization: <scheme> <access token>} headers.
 * <p>
 * Framework-independent: the HTTP layer passes the raw header and pattern-matches the
 * returned {@link AuthenticationResult}. Token failures become {@link AuthenticationResult.Rejected}
 * with a precise reason that is logged here; directory failures propagate unchanged.
 * Stateless and safe for concurrent use.
 */
public class BearerTokenAuthenticator {

    /** Default scheme prefix. */
    public static final String DEFAULT_SCHEME = "Bearer";

    private static final Logger log = LoggerFactory.getLogger(BearerTokenAuthenticator.class);

    private final String schemePrefix;
    private final TokensManager tokensManager;
    private final PrincipalDirectory directory;
    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    public BearerTokenAuthenticator(TokensManager tokensManager, PrincipalDirectory directory) {
        this(DEFAULT_SCHEME, tokensManager, directory);
    }

    public BearerTokenAuthenticator(String schemePrefix, TokensManager tokensManager, PrincipalDirectory directory) {
        if (schemePrefix == null || schemePrefix.isBlank() || schemePrefix.strip().contains(" ")) {
            throw new IllegalArgumentException("schemePrefix must be a single non-blank word");
        }
        if (tokensManager == null || directory == null) {
            throw new IllegalArgumentException("tokensManager and directory must not be null");
        }
        this.schemePrefix = schemePrefix.strip();
        this.tokensManager = tokensManager;
        this.directory = directory;
    }

    /**
     * Authenticates a request from its Authorization header.
     *
     * @param authorizationHeader raw header value (may be null)
     * @return Anonymous, Authenticated or Rejected; never null
     */
    public AuthenticationResult authenticate(String authorizationHeader) {
        Optional<AuthorizationHeader> header = AuthorizationHeader.parse(authorizationHeader);
        if (header.isEmpty() || !header.get().hasScheme(schemePrefix)) {
            return AuthenticationResult.anonymous();
        }
        if (!header.get().hasCredentials()) {
            return reject(RejectionReason.MISSING_TOKEN, authorizationHeader, null);
        }

        AccessClaims claims;
        try {
            claims = tokensManager.decodeAccess(header.get().credentials());
        } catch (TokenExpiredException e) {
            return reject(RejectionReason.EXPIRED_TOKEN, authorizationHeader, e);
        } catch (AudienceMismatchException e) {
            return reject(RejectionReason.WRONG_AUDIENCE, authorizationHeader, e);
        } catch (TokenException e) {
            return reject(RejectionReason.INVALID_TOKEN, authorizationHeader, e);
        }

        Optional<Principal> principal = directory.findPrincipalById(claims.principalId());
        if (principal.isEmpty()) {
            return reject(RejectionReason.UNKNOWN_PRINCIPAL, authorizationHeader, null);
        }
        if (!principal.get().isActive()) {
            return reject(RejectionReason.INACTIVE_PRINCIPAL, authorizationHeader, null);
        }

        log.debug("Authenticated principal {}", claims.principalId());
        return new AuthenticationResult.Authenticated(principal.get(), claims);
    }

    /** The scheme this authenticator accepts. */
    public String schemePrefix() {
        return schemePrefix;
    }

    private AuthenticationResult reject(RejectionReason reason, String authorizationHeader, TokenException cause) {
        log.info("Rejected credentials [{}]: {}{}",
                redactor.maskCredentials(authorizationHeader),
                reason,
                cause == null ? "" : " (" + cause.getMessage() + ")");
        return new AuthenticationResult.Rejected(reason);
    }
}
