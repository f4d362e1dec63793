package com.flagship.escrow_engine.agreement;

import com.flagship.escrow_engine.agreement.exception.EscrowException;
import com.flagship.escrow_engine.ledger.Identity;
import lombok.Value;

import java.time.Instant;

/**
 * Escrow agreement domain object.
 *
 * Key principles:
 * - Status transitions are explicit and validated
 * - Invalid transitions are rejected with INVALID_STATUS
 * - State changes are immutable (each transition returns a new Agreement)
 * - Only the status ever changes; parties, amount, description and creation time are fixed
 */
@Value
public class Agreement {

    public static final int MAX_DESCRIPTION_LENGTH = 256;

    long id;
    Identity vendor;
    Identity buyer;
    long amount;
    String description;
    AgreementStatus status;
    Instant createdAt;

    /**
     * Creates a new agreement in PENDING status.
     *
     * @throws IllegalArgumentException if an argument is missing or out of range
     */
    public static Agreement create(long id, Identity vendor, Identity buyer, long amount,
                                   String description, Instant createdAt) {
        if (id <= 0) {
            throw new IllegalArgumentException("Agreement ID must be positive");
        }
        if (vendor == null || buyer == null) {
            throw new IllegalArgumentException("Vendor and buyer are required");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("Agreement amount must be positive");
        }
        if (description == null) {
            throw new IllegalArgumentException("Description is required");
        }
        if (hasUnpairedSurrogate(description)) {
            throw new IllegalArgumentException("Description is not valid Unicode text");
        }
        if (description.codePointCount(0, description.length()) > MAX_DESCRIPTION_LENGTH) {
            throw new IllegalArgumentException(
                "Description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return new Agreement(id, vendor, buyer, amount, description, AgreementStatus.PENDING, createdAt);
    }

    private static boolean hasUnpairedSurrogate(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < text.length()
                    && Character.isLowSurrogate(text.charAt(i + 1))) {
                i++;
            } else if (Character.isSurrogate(c)) {
                return true;
            }
        }
        return false;
    }

    public Agreement fund() {
        return transition(AgreementStatus.PENDING, AgreementStatus.FUNDED);
    }

    public Agreement accept() {
        return transition(AgreementStatus.FUNDED, AgreementStatus.ACCEPTED);
    }

    public Agreement complete() {
        return transition(AgreementStatus.ACCEPTED, AgreementStatus.COMPLETED);
    }

    public Agreement dispute() {
        return transition(AgreementStatus.ACCEPTED, AgreementStatus.DISPUTED);
    }

    public Agreement refund() {
        return transition(AgreementStatus.DISPUTED, AgreementStatus.REFUNDED);
    }

    public boolean isBuyer(Identity identity) {
        return buyer.equals(identity);
    }

    /**
     * @throws EscrowException with INVALID_STATUS if this agreement is not in {@code required}
     */
    public void requireStatus(AgreementStatus required) {
        if (status != required) {
            throw EscrowException.invalidStatus(id, status, required);
        }
    }

    private Agreement transition(AgreementStatus from, AgreementStatus to) {
        requireStatus(from);
        return new Agreement(id, vendor, buyer, amount, description, to, createdAt);
    }
}
