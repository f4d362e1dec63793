package com.flagship.escrow_engine.agreement.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for agreement lifecycle events.
 *
 * Events are facts: each one records a committed transition and is written
 * to the outbox in the same transaction as the transition itself.
 */
public interface AgreementEvent {

    /**
     * Unique identifier for this event instance, for consumer deduplication.
     */
    UUID getEventId();

    long getAgreementId();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
