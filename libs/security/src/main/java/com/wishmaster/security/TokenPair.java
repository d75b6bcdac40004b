package com.wishmaster.security;

/**
 * Access and refresh tokens issued together on login or refresh.
 *
 * @param accessToken  ACCESS-audience token presented as {@code Authorization: Bearer ...}
 * @param refreshToken REFRESH-audience token, accepted only by the refresh and logout operations
 */
public record TokenPair(String accessToken, String refreshToken) {

    @Override
    public String toString() {
        return "TokenPair[accessToken=***, refreshToken=***]";
    }
}
