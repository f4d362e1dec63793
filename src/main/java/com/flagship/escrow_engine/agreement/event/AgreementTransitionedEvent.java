package com.flagship.escrow_engine.agreement.event;

import com.flagship.escrow_engine.agreement.Agreement;
import com.flagship.escrow_engine.agreement.AgreementStatus;
import com.flagship.escrow_engine.ledger.Identity;
import lombok.Value;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Published when an agreement moves to a new status.
 *
 * Fund-moving transitions (fund, complete, refund) also carry the ledger
 * transaction and the two sides of the transfer; for accept and dispute those
 * fields are null.
 */
@Value
public class AgreementTransitionedEvent implements AgreementEvent {
    UUID eventId;
    String eventType;
    long agreementId;
    AgreementStatus previousStatus;
    AgreementStatus status;
    String actor;
    Long amount;
    String transferFrom;
    String transferTo;
    UUID ledgerTransactionId;
    Instant occurredAt;

    /**
     * Event type for a transition into {@code status}, e.g. AgreementFunded.
     */
    public static String eventTypeFor(AgreementStatus status) {
        String name = status.name();
        return "Agreement" + name.charAt(0) + name.substring(1).toLowerCase(Locale.ROOT);
    }

    public static AgreementTransitionedEvent of(AgreementStatus previousStatus, Agreement agreement,
                                                Identity actor, Instant occurredAt) {
        return new AgreementTransitionedEvent(
            UUID.randomUUID(),
            eventTypeFor(agreement.getStatus()),
            agreement.getId(),
            previousStatus,
            agreement.getStatus(),
            actor.getPrincipal(),
            null,
            null,
            null,
            null,
            occurredAt
        );
    }

    public static AgreementTransitionedEvent withTransfer(AgreementStatus previousStatus, Agreement agreement,
                                                          Identity actor, Identity from, Identity to,
                                                          UUID ledgerTransactionId, Instant occurredAt) {
        return new AgreementTransitionedEvent(
            UUID.randomUUID(),
            eventTypeFor(agreement.getStatus()),
            agreement.getId(),
            previousStatus,
            agreement.getStatus(),
            actor.getPrincipal(),
            agreement.getAmount(),
            from.getPrincipal(),
            to.getPrincipal(),
            ledgerTransactionId,
            occurredAt
        );
    }
}
