package com.flagship.escrow_engine.agreement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.agreement.Agreement;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Request body for creating an agreement. The vendor is the caller, not part of the body.
 */
@Value
public class CreateAgreementRequest {

    @NotBlank(message = "Buyer is required")
    @JsonProperty("buyer")
    String buyer;

    @NotNull(message = "Amount is required")
    @Min(value = 1, message = "Amount must be greater than 0")
    @JsonProperty("amount")
    Long amount;

    @NotNull(message = "Description is required")
    @Size(max = Agreement.MAX_DESCRIPTION_LENGTH, message = "Description must be at most 256 characters")
    @JsonProperty("description")
    String description;
}
