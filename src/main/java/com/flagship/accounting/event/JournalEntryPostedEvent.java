package com.flagship.accounting.event;

import com.flagship.accounting.ledger.JournalEntry;
import com.flagship.accounting.ledger.JournalLine;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Published when a journal entry reaches POSTED and its ledger rows exist.
 */
@Value
public class JournalEntryPostedEvent implements AccountingEvent {
    UUID eventId;
    UUID journalEntryId;
    String entryNumber;
    LocalDate entryDate;
    String entryType;
    String sourceType;
    UUID sourceId;
    BigDecimal totalAmount;
    List<Line> lines;
    String postedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryPosted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return journalEntryId;
    }

    public static JournalEntryPostedEvent from(JournalEntry entry) {
        return new JournalEntryPostedEvent(
            UUID.randomUUID(),
            entry.getId(),
            entry.getEntryNumber(),
            entry.getEntryDate(),
            entry.getEntryType().name(),
            entry.getSourceType(),
            entry.getSourceId(),
            entry.getTotalDebit(),
            entry.getLines().stream().map(Line::from).toList(),
            entry.getPostedBy(),
            Instant.now()
        );
    }

    @Value
    public static class Line {
        UUID accountId;
        BigDecimal debit;
        BigDecimal credit;
        UUID costCenterId;

        static Line from(JournalLine line) {
            return new Line(line.getAccountId(), line.getDebit(), line.getCredit(), line.getCostCenterId());
        }
    }
}
