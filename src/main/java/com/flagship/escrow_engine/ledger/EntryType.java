package com.flagship.escrow_engine.ledger;

/**
 * Side of a double-entry posting. Every ledger transaction carries
 * debits and credits of equal total.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
