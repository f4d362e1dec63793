package com.flagship.escrow_engine.agreement;

import lombok.Value;

/**
 * Funds held in custody for one agreement, from funding until completion or refund.
 */
@Value
public class EscrowBalance {
    long agreementId;
    long balance;
}
