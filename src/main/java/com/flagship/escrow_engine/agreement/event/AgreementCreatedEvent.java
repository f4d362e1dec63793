package com.flagship.escrow_engine.agreement.event;

import com.flagship.escrow_engine.agreement.Agreement;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a vendor creates an agreement.
 */
@Value
public class AgreementCreatedEvent implements AgreementEvent {
    UUID eventId;
    long agreementId;
    String vendor;
    String buyer;
    long amount;
    String description;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AgreementCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static AgreementCreatedEvent fromAgreement(Agreement agreement) {
        return new AgreementCreatedEvent(
            UUID.randomUUID(),
            agreement.getId(),
            agreement.getVendor().getPrincipal(),
            agreement.getBuyer().getPrincipal(),
            agreement.getAmount(),
            agreement.getDescription(),
            agreement.getCreatedAt()
        );
    }
}
