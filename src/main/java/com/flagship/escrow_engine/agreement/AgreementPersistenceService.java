package com.flagship.escrow_engine.agreement;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Database-backed {@link AgreementStore}.
 *
 * Bridges the domain layer (Agreement, EscrowBalance) and the persistence layer
 * (AgreementEntity, EscrowBalanceEntity, the counter row). Writes join the
 * caller's transaction, so an engine operation commits or rolls back as a whole.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgreementPersistenceService implements AgreementStore {

    private final AgreementRepository agreementRepository;
    private final EscrowBalanceRepository escrowBalanceRepository;
    private final AgreementIdSequence agreementIdSequence;

    @Override
    @Transactional
    public long lastAgreementId() {
        return agreementIdSequence.lastForUpdate();
    }

    @Override
    @Transactional
    public void recordAgreementId(long agreementId) {
        agreementIdSequence.advanceTo(agreementId);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(long agreementId) {
        return agreementRepository.existsById(agreementId);
    }

    @Override
    @Transactional
    public void insert(Agreement agreement, String idempotencyKey) {
        AgreementEntity saved = agreementRepository.save(AgreementEntity.fromDomain(agreement, idempotencyKey));
        log.debug("Saved agreement {} with idempotency key {}", saved.getId(), idempotencyKey);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Agreement> findById(long agreementId) {
        return agreementRepository.findById(agreementId)
            .map(AgreementEntity::toDomain);
    }

    @Override
    @Transactional
    public Optional<Agreement> findByIdForUpdate(long agreementId) {
        return agreementRepository.findByIdForUpdate(agreementId)
            .map(AgreementEntity::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Long> findIdByIdempotencyKey(String idempotencyKey) {
        return agreementRepository.findByIdempotencyKey(idempotencyKey)
            .map(AgreementEntity::getId);
    }

    /**
     * Uses the controlled update method instead of setters so that only the status can change.
     */
    @Override
    @Transactional
    public void updateStatus(Agreement agreement) {
        AgreementEntity existing = agreementRepository.findById(agreement.getId())
            .orElseThrow(() -> new IllegalStateException("Agreement disappeared: " + agreement.getId()));

        existing.updateFromDomain(agreement);
        agreementRepository.save(existing);
        log.debug("Updated agreement {} to {}", agreement.getId(), agreement.getStatus());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<EscrowBalance> findEscrowBalance(long agreementId) {
        return escrowBalanceRepository.findById(agreementId)
            .map(EscrowBalanceEntity::toDomain);
    }

    @Override
    @Transactional
    public void saveEscrowBalance(EscrowBalance escrowBalance) {
        escrowBalanceRepository.save(EscrowBalanceEntity.fromDomain(escrowBalance));
    }

    @Override
    @Transactional
    public void deleteEscrowBalance(long agreementId) {
        escrowBalanceRepository.deleteById(agreementId);
    }
}
