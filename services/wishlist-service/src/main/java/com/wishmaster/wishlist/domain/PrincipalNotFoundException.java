package com.wishmaster.wishlist.domain;

import java.util.UUID;

/** No principal with the requested id exists. */
public class PrincipalNotFoundException extends RuntimeException {

    private final UUID principalId;

    public PrincipalNotFoundException(UUID principalId) {
        super("Principal %s not found".formatted(principalId));
        this.principalId = principalId;
    }

    public UUID principalId() {
        return principalId;
    }
}
