package com.flagship.escrow_engine.agreement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.agreement.Agreement;
import com.flagship.escrow_engine.agreement.AgreementStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AgreementResponse {

    @JsonProperty("id")
    long id;

    @JsonProperty("vendor")
    String vendor;

    @JsonProperty("buyer")
    String buyer;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("description")
    String description;

    @JsonProperty("status")
    AgreementStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AgreementResponse from(Agreement agreement) {
        return AgreementResponse.builder()
            .id(agreement.getId())
            .vendor(agreement.getVendor().getPrincipal())
            .buyer(agreement.getBuyer().getPrincipal())
            .amount(agreement.getAmount())
            .description(agreement.getDescription())
            .status(agreement.getStatus())
            .createdAt(agreement.getCreatedAt())
            .build();
    }
}
