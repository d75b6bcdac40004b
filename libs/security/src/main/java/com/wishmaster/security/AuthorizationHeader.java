package com.wishmaster.security;

import java.util.Optional;

/**
 * Parsed {@code Authorization} header: {@code "<scheme> <credentials>"}.
 * <p>
 * The scheme is the first whitespace-delimited word; credentials are the stripped remainder,
 * empty when the header holds only a scheme. {@code "Bearerabc"} therefore has scheme
 * {@code Bearerabc}, not {@code Bearer}.
 *
 * @param scheme      authentication scheme as sent by the client
 * @param credentials everything after the scheme (may be empty, never null)
 */
public record AuthorizationHeader(String scheme, String credentials) {

    /**
     * Parses a raw header value.
     *
     * @param headerValue the full Authorization header value (may be null)
     * @return the parsed header, or empty if the value is missing or blank
     */
    public static Optional<AuthorizationHeader> parse(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return Optional.empty();
        }
        String trimmed = headerValue.strip();
        int separator = indexOfWhitespace(trimmed);
        if (separator < 0) {
            return Optional.of(new AuthorizationHeader(trimmed, ""));
        }
        return Optional.of(new AuthorizationHeader(
                trimmed.substring(0, separator),
                trimmed.substring(separator).strip()));
    }

    /** Case-insensitive scheme comparison. */
    public boolean hasScheme(String expectedScheme) {
        return scheme.equalsIgnoreCase(expectedScheme);
    }

    /** Whether any credentials follow the scheme. */
    public boolean hasCredentials() {
        return !credentials.isEmpty();
    }

    @Override
    public String toString() {
        return "AuthorizationHeader[scheme=%s, credentials=***]".formatted(scheme);
    }

    private static int indexOfWhitespace(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (Character.isWhitespace(value.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
