package com.flagship.escrow_engine.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

@Value
public class DepositResponse {

    @JsonProperty("ledger_transaction_id")
    UUID ledgerTransactionId;

    @JsonProperty("owner")
    String owner;

    @JsonProperty("balance")
    long balance;
}
