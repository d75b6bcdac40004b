package com.wishmaster.security;

/**
 * The token was authentic and unexpired, but issued for a different audience than the
 * consuming operation expects (e.g., a refresh token presented as a bearer token).
 */
public class AudienceMismatchException extends TokenException {

    private final TokenAudience expected;
    private final String actual;

    public AudienceMismatchException(TokenAudience expected, String actual) {
        super("Token audience '%s' does not match expected '%s'".formatted(actual, expected.value()));
        this.expected = expected;
        this.actual = actual;
    }

    public TokenAudience expected() {
        return expected;
    }

    /** Raw {@code aud} value found in the token (may be null). */
    public String actual() {
        return actual;
    }
}
