package com.flagship.escrow_engine.agreement;

import com.flagship.escrow_engine.agreement.exception.EscrowErrorCode;
import com.flagship.escrow_engine.agreement.exception.EscrowException;
import com.flagship.escrow_engine.ledger.Identity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Agreement domain object: creation rules and status transitions.
 */
class AgreementTest {

    private static final Identity VENDOR = Identity.of("vendor");
    private static final Identity BUYER = Identity.of("buyer");
    private static final Instant CREATED_AT = Instant.parse("2024-01-15T09:30:00Z");

    private Agreement pending() {
        return Agreement.create(1, VENDOR, BUYER, 250, "translation", CREATED_AT);
    }

    @Test
    @DisplayName("New agreements start PENDING")
    void testCreate_StartsPending() {
        Agreement agreement = pending();

        assertEquals(AgreementStatus.PENDING, agreement.getStatus());
        assertEquals(1, agreement.getId());
        assertEquals(CREATED_AT, agreement.getCreatedAt());
        assertFalse(agreement.getStatus().holdsCustody());
    }

    @Test
    @DisplayName("Create rejects out-of-range input")
    void testCreate_RejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class,
            () -> Agreement.create(0, VENDOR, BUYER, 1, "d", CREATED_AT));
        assertThrows(IllegalArgumentException.class,
            () -> Agreement.create(1, VENDOR, BUYER, -5, "d", CREATED_AT));
        assertThrows(IllegalArgumentException.class,
            () -> Agreement.create(1, null, BUYER, 1, "d", CREATED_AT));
        assertThrows(IllegalArgumentException.class,
            () -> Agreement.create(1, VENDOR, BUYER, 1, null, CREATED_AT));
    }

    @Test
    @DisplayName("Description limit counts characters, not UTF-16 units")
    void testCreate_DescriptionLimit() {
        String atLimit = "x".repeat(Agreement.MAX_DESCRIPTION_LENGTH);
        assertEquals(atLimit, Agreement.create(1, VENDOR, BUYER, 1, atLimit, CREATED_AT).getDescription());

        // 256 emoji are 512 chars but 256 code points
        String emoji = "😀".repeat(Agreement.MAX_DESCRIPTION_LENGTH);
        assertNotNull(Agreement.create(1, VENDOR, BUYER, 1, emoji, CREATED_AT));

        assertThrows(IllegalArgumentException.class,
            () -> Agreement.create(1, VENDOR, BUYER, 1, atLimit + "y", CREATED_AT));
    }

    @Test
    @DisplayName("Descriptions with unpaired surrogates are rejected")
    void testCreate_RejectsUnpairedSurrogate() {
        assertThrows(IllegalArgumentException.class,
            () -> Agreement.create(1, VENDOR, BUYER, 1, "broken \uD83D text", CREATED_AT));
        assertThrows(IllegalArgumentException.class,
            () -> Agreement.create(1, VENDOR, BUYER, 1, "\uDE00 leading low", CREATED_AT));
        assertThrows(IllegalArgumentException.class,
            () -> Agreement.create(1, VENDOR, BUYER, 1, "trailing high \uD83D", CREATED_AT));
        assertNotNull(Agreement.create(1, VENDOR, BUYER, 1, "paired \uD83D\uDE00", CREATED_AT));
    }

    @Test
    @DisplayName("Transitions return new instances and leave the original untouched")
    void testTransitions_AreImmutable() {
        Agreement pending = pending();
        Agreement funded = pending.fund();

        assertEquals(AgreementStatus.PENDING, pending.getStatus());
        assertEquals(AgreementStatus.FUNDED, funded.getStatus());
        assertEquals(pending.getAmount(), funded.getAmount());
        assertEquals(pending.getBuyer(), funded.getBuyer());
        assertTrue(funded.getStatus().holdsCustody());
    }

    @Test
    @DisplayName("Both lifecycle paths end in terminal states")
    void testTransitions_LifecyclePaths() {
        Agreement accepted = pending().fund().accept();

        Agreement completed = accepted.complete();
        assertTrue(completed.getStatus().isTerminal());
        assertFalse(completed.getStatus().holdsCustody());

        Agreement disputed = accepted.dispute();
        assertTrue(disputed.getStatus().holdsCustody());
        Agreement refunded = disputed.refund();
        assertTrue(refunded.getStatus().isTerminal());
    }

    @Test
    @DisplayName("Out-of-order transitions fail with INVALID_STATUS")
    void testTransitions_RejectInvalidSource() {
        Agreement pending = pending();

        EscrowException exception = assertThrows(EscrowException.class, pending::accept);
        assertEquals(EscrowErrorCode.INVALID_STATUS, exception.getErrorCode());
        assertEquals(1L, exception.getAgreementId());

        assertThrows(EscrowException.class, pending::complete);
        assertThrows(EscrowException.class, pending::dispute);
        assertThrows(EscrowException.class, pending::refund);
        assertThrows(EscrowException.class, () -> pending.fund().fund());
        assertThrows(EscrowException.class, () -> pending.fund().accept().complete().dispute());
    }

    @Test
    @DisplayName("Buyer check compares identities exactly")
    void testIsBuyer() {
        Agreement agreement = pending();

        assertTrue(agreement.isBuyer(Identity.of("buyer")));
        assertFalse(agreement.isBuyer(Identity.of("BUYER")));
        assertFalse(agreement.isBuyer(VENDOR));
    }
}
