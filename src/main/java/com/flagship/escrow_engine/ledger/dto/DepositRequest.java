package com.flagship.escrow_engine.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Credits value that arrived from outside the ledger (card capture, bank transfer) to a wallet.
 */
@Value
public class DepositRequest {

    @NotBlank(message = "Owner is required")
    @JsonProperty("owner")
    String owner;

    @NotNull(message = "Amount is required")
    @Min(value = 1, message = "Amount must be greater than 0")
    @JsonProperty("amount")
    Long amount;
}
