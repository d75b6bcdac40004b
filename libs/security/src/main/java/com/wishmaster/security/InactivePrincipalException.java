package com.wishmaster.security;

import java.util.UUID;

/**
 * The principal was resolved but its status (ARCHIVED or UNCONFIRMED) disqualifies it from
 * obtaining or refreshing tokens.
 */
public class InactivePrincipalException extends RuntimeException {

    private final UUID principalId;
    private final PrincipalStatus status;

    public InactivePrincipalException(UUID principalId, PrincipalStatus status) {
        super("Principal %s is %s".formatted(principalId, status));
        this.principalId = principalId;
        this.status = status;
    }

    public UUID principalId() {
        return principalId;
    }

    public PrincipalStatus status() {
        return status;
    }
}
