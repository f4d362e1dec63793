package com.flagship.escrow_engine.agreement;

import com.flagship.escrow_engine.ledger.Identity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA Entity for agreement persistence.
 *
 * Key design principles:
 * - No @Setter: status changes go through updateFromDomain() only
 * - Every column except status is updatable = false
 * - Controlled factory: fromDomain() is the only way to create entities
 *
 * The idempotency key is a persistence concern of the create endpoint and
 * has no counterpart in the domain object.
 */
@Entity
@Table(
    name = "agreements",
    indexes = {
        @Index(name = "idx_agreements_idempotency_key", columnList = "idempotency_key"),
        @Index(name = "idx_agreements_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AgreementEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private Long id;

    @Column(nullable = false, updatable = false, length = 128)
    private String vendor;

    @Column(nullable = false, updatable = false, length = 128)
    private String buyer;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Column(nullable = false, updatable = false, length = Agreement.MAX_DESCRIPTION_LENGTH)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AgreementStatus status;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static AgreementEntity fromDomain(Agreement agreement, String idempotencyKey) {
        return new AgreementEntity(
            agreement.getId(),
            agreement.getVendor().getPrincipal(),
            agreement.getBuyer().getPrincipal(),
            agreement.getAmount(),
            agreement.getDescription(),
            agreement.getStatus(),
            idempotencyKey,
            agreement.getCreatedAt()
        );
    }

    public Agreement toDomain() {
        return new Agreement(
            id,
            Identity.of(vendor),
            Identity.of(buyer),
            amount,
            description,
            status,
            createdAt
        );
    }

    /**
     * Only the status is taken from the domain object; everything else was fixed at creation.
     */
    void updateFromDomain(Agreement agreement) {
        if (agreement.getId() != this.id) {
            throw new IllegalArgumentException(
                "Cannot update agreement " + this.id + " from agreement " + agreement.getId());
        }
        this.status = agreement.getStatus();
    }
}
