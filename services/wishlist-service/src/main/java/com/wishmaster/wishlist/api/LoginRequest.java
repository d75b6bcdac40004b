package com.wishmaster.wishlist.api;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/** Body of {@code POST /api/v1/tokens}. */
public record LoginRequest(@NotBlank @Email String email, @NotBlank String password) {

    @Override
    public String toString() {
        return "LoginRequest[email=%s, password=***]".formatted(email);
    }
}
