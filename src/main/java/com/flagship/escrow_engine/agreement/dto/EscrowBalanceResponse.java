package com.flagship.escrow_engine.agreement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.escrow_engine.agreement.EscrowBalance;
import lombok.Value;

@Value
public class EscrowBalanceResponse {

    @JsonProperty("agreement_id")
    long agreementId;

    @JsonProperty("balance")
    long balance;

    public static EscrowBalanceResponse from(EscrowBalance escrowBalance) {
        return new EscrowBalanceResponse(escrowBalance.getAgreementId(), escrowBalance.getBalance());
    }
}
