package com.wishmaster.wishlist.api;

import jakarta.validation.constraints.NotBlank;

/** Body of {@code PUT} and {@code DELETE /api/v1/tokens}. */
public record RefreshRequest(@NotBlank String refreshToken) {

    @Override
    public String toString() {
        return "RefreshRequest[refreshToken=***]";
    }
}
