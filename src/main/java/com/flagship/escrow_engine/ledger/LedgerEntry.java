package com.flagship.escrow_engine.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * One side of a posted ledger transaction. Immutable once written.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID transactionId;
    UUID accountId;
    long amount;
    EntryType entryType;
    String description;
    Long sequenceNumber;
}
