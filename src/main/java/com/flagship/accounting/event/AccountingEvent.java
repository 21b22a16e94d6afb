package com.flagship.accounting.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact recorded by the accounting core and relayed through the outbox.
 *
 * Consumers deduplicate on {@link #getEventId()} and partition on the aggregate id.
 */
public interface AccountingEvent {

    UUID getEventId();

    UUID getAggregateId();

    Instant getOccurredAt();

    String getEventType();
}
