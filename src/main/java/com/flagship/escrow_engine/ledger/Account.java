package com.flagship.escrow_engine.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * A ledger account owned by a single identity.
 *
 * Wallets (buyers, vendors, custody) are LIABILITY accounts: the system owes
 * their balance to the owner. The reserve that backs deposits is an ASSET.
 */
@Value
public class Account {
    UUID id;
    Identity owner;
    AccountType accountType;

    public enum AccountType {
        ASSET,
        LIABILITY
    }
}
