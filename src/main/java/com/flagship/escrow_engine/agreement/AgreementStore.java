package com.flagship.escrow_engine.agreement;

import java.util.Optional;

/**
 * Storage for the agreement registry, the escrow-balance registry and the
 * agreement ID counter. The escrow engine is its only writer.
 */
public interface AgreementStore {

    /**
     * The last ID handed out, 0 before the first agreement. Holds the counter
     * until the current transaction ends.
     */
    long lastAgreementId();

    /**
     * Advances the counter to {@code agreementId}.
     */
    void recordAgreementId(long agreementId);

    boolean exists(long agreementId);

    void insert(Agreement agreement, String idempotencyKey);

    Optional<Agreement> findById(long agreementId);

    /**
     * Loads an agreement and holds it against concurrent transitions until the
     * current transaction ends.
     */
    Optional<Agreement> findByIdForUpdate(long agreementId);

    Optional<Long> findIdByIdempotencyKey(String idempotencyKey);

    /**
     * Persists the status of an already stored agreement. Other fields are never written.
     */
    void updateStatus(Agreement agreement);

    Optional<EscrowBalance> findEscrowBalance(long agreementId);

    void saveEscrowBalance(EscrowBalance escrowBalance);

    void deleteEscrowBalance(long agreementId);
}
