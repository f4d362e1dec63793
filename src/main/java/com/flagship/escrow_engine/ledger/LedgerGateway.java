package com.flagship.escrow_engine.ledger;

import java.util.UUID;

/**
 * Value-transfer primitive the escrow engine moves custody funds through.
 *
 * Implementations must be atomic: a transfer either fully happens or has
 * no effect at all. They participate in the caller's transaction so that a
 * later failure in the same unit of work also undoes the transfer.
 */
public interface LedgerGateway {

    /**
     * Moves {@code amount} from one identity to another.
     *
     * @param amount Positive amount to move
     * @param from Identity being debited
     * @param to Identity being credited
     * @return ID of the ledger transaction recording the move
     * @throws InsufficientFundsException if {@code from} cannot cover the amount
     */
    UUID transfer(long amount, Identity from, Identity to);

    /**
     * The identity that holds escrowed funds on behalf of agreements.
     */
    Identity custodyIdentity();
}
