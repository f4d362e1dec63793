package com.flagship.escrow_engine.agreement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.agreement.AgreementStatus;
import lombok.Value;

/**
 * Result of a successful fund/accept/complete/dispute/refund call.
 */
@Value
public class TransitionResponse {

    @JsonProperty("agreement_id")
    long agreementId;

    @JsonProperty("result")
    boolean result;

    @JsonProperty("status")
    AgreementStatus status;
}
