package com.flagship.escrow_engine.agreement;

/**
 * Lifecycle status of an escrow agreement.
 *
 * PENDING → FUNDED → ACCEPTED → COMPLETED
 *                            ↘ DISPUTED → REFUNDED
 */
public enum AgreementStatus {
    /**
     * Created by the vendor, not yet funded. Initial state.
     */
    PENDING,

    /**
     * Buyer has deposited the amount into custody.
     */
    FUNDED,

    /**
     * Buyer has acknowledged the funded agreement.
     */
    ACCEPTED,

    /**
     * Custody released to the vendor. Terminal.
     */
    COMPLETED,

    /**
     * Buyer has raised a dispute; awaiting the arbiter.
     */
    DISPUTED,

    /**
     * Arbiter returned custody to the buyer. Terminal.
     */
    REFUNDED;

    public boolean isTerminal() {
        return this == COMPLETED || this == REFUNDED;
    }

    /**
     * Whether an agreement in this status has funds in custody.
     */
    public boolean holdsCustody() {
        return this == FUNDED || this == ACCEPTED || this == DISPUTED;
    }
}
