package com.flagship.escrow_engine.agreement;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for the custody record of a funded agreement.
 * Rows are inserted on funding and deleted on completion or refund, never updated.
 */
@Entity
@Table(name = "escrow_balances")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EscrowBalanceEntity {

    @Id
    @Column(name = "agreement_id", nullable = false, updatable = false)
    private Long agreementId;

    @Column(nullable = false, updatable = false)
    private long balance;

    static EscrowBalanceEntity fromDomain(EscrowBalance escrowBalance) {
        return new EscrowBalanceEntity(escrowBalance.getAgreementId(), escrowBalance.getBalance());
    }

    public EscrowBalance toDomain() {
        return new EscrowBalance(agreementId, balance);
    }
}
