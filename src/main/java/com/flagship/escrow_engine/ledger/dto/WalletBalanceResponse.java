package com.flagship.escrow_engine.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class WalletBalanceResponse {

    @JsonProperty("owner")
    String owner;

    @JsonProperty("balance")
    long balance;
}
