package com.wishmaster.observability;

/**
 * Masks credentials before they reach log output.
 * <p>
 * {@link #maskCredentials(String)} takes a raw {@code Authorization} header value and keeps
 * only the scheme, so log lines still show which kind of credentials a caller presented.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    /**
     * Masks the credentials part of an {@code Authorization} header value.
     * <p>
     * {@code "Bearer eyJ..."} becomes {@code "Bearer [REDACTED]"}; a value without a scheme is
     * fully redacted; null stays null.
     *
     * @param authorizationHeader raw header value (may be null)
     * @return the masked value
     */
    public String maskCredentials(String authorizationHeader) {
        if (authorizationHeader == null) {
            return null;
        }
        String trimmed = authorizationHeader.strip();
        int space = trimmed.indexOf(' ');
        if (space < 0) {
            return trimmed.isEmpty() ? trimmed : REDACTED;
        }
        return trimmed.substring(0, space) + " " + REDACTED;
    }
}
