package com.flagship.escrow_engine.ledger;

import lombok.Getter;

/**
 * Raised by the ledger when the debited identity cannot cover a transfer.
 * Nothing has been written when this is thrown.
 */
@Getter
public class InsufficientFundsException extends RuntimeException {

    private final Identity owner;
    private final long requested;
    private final long available;

    public InsufficientFundsException(Identity owner, long requested, long available) {
        super(String.format("Insufficient funds for %s: requested=%d, available=%d",
                owner, requested, available));
        this.owner = owner;
        this.requested = requested;
        this.available = available;
    }
}
