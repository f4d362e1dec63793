package com.flagship.escrow_engine.ledger;

import lombok.Value;

/**
 * An authenticated principal: a vendor, a buyer, the arbiter or the escrow custody account.
 *
 * Identities are opaque to the engine; equality is exact string equality
 * of the principal.
 */
@Value
public class Identity {
    String principal;

    private Identity(String principal) {
        if (principal == null || principal.isBlank()) {
            throw new IllegalArgumentException("Identity principal is required");
        }
        this.principal = principal;
    }

    public static Identity of(String principal) {
        return new Identity(principal);
    }

    @Override
    public String toString() {
        return principal;
    }
}
