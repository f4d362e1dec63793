package com.flagship.escrow_engine.agreement;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for agreement persistence.
 */
@Repository
public interface AgreementRepository extends JpaRepository<AgreementEntity, Long> {

    /**
     * Loads an agreement with a row lock (SELECT ... FOR UPDATE) so that
     * transitions on the same agreement are serialized.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AgreementEntity a WHERE a.id = :id")
    Optional<AgreementEntity> findByIdForUpdate(@Param("id") Long id);

    Optional<AgreementEntity> findByIdempotencyKey(String idempotencyKey);
}
