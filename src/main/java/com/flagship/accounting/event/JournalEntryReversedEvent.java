package com.flagship.accounting.event;

import com.flagship.accounting.ledger.JournalEntry;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class JournalEntryReversedEvent implements AccountingEvent {
    UUID eventId;
    UUID journalEntryId;
    String entryNumber;
    UUID reversalEntryId;
    String reversalEntryNumber;
    LocalDate reversalDate;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryReversed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return journalEntryId;
    }

    public static JournalEntryReversedEvent from(JournalEntry original, JournalEntry reversal, String reason) {
        return new JournalEntryReversedEvent(UUID.randomUUID(), original.getId(), original.getEntryNumber(),
            reversal.getId(), reversal.getEntryNumber(), reversal.getEntryDate(), reason, Instant.now());
    }
}
