package com.flagship.accounting.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A balanced double-entry posting and its lines.
 *
 * Immutable: transitions return a new instance and reject moves the status table forbids.
 */
@Value
public class JournalEntry {
    UUID id;
    String entryNumber;
    LocalDate entryDate;
    UUID periodId;
    JournalEntryType entryType;
    String sourceType;
    UUID sourceId;
    String sourceNumber;
    String narration;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    JournalEntryStatus status;
    boolean reversed;
    UUID reversalOfId;
    UUID reversedById;
    String createdBy;
    String postedBy;
    Instant postedAt;
    String cancelledBy;
    Instant cancelledAt;
    List<JournalLine> lines;

    /**
     * Builds a new entry from a validated request. Lines are numbered from 1 in request order.
     */
    static JournalEntry fromRequest(PostingRequest request, String entryNumber, UUID periodId,
                                    JournalEntryStatus status, UUID reversalOfId) {
        List<JournalLine> lines = new ArrayList<>();
        int lineNumber = 0;
        for (PostingLine line : request.getLines()) {
            lineNumber++;
            lines.add(new JournalLine(UUID.randomUUID(), lineNumber, line.getAccountId(),
                line.getDebit(), line.getCredit(), line.getDescription(), line.getCostCenterId()));
        }
        SourceRef source = request.getSource();
        boolean posted = status == JournalEntryStatus.POSTED;
        return new JournalEntry(
            UUID.randomUUID(),
            entryNumber,
            request.getEntryDate(),
            periodId,
            request.getEntryType(),
            source != null ? source.getSourceType() : null,
            source != null ? source.getSourceId() : null,
            source != null ? source.getSourceNumber() : null,
            request.getNarration(),
            request.getDebitTotal(),
            request.getCreditTotal(),
            status,
            false,
            reversalOfId,
            null,
            request.getCreatedBy(),
            posted ? request.getCreatedBy() : null,
            posted ? Instant.now() : null,
            null,
            null,
            List.copyOf(lines)
        );
    }

    public JournalEntry post(String user, UUID postingPeriodId) {
        requireTransition(JournalEntryStatus.POSTED);
        return new JournalEntry(id, entryNumber, entryDate, postingPeriodId, entryType, sourceType, sourceId,
            sourceNumber, narration, totalDebit, totalCredit, JournalEntryStatus.POSTED, reversed,
            reversalOfId, reversedById, createdBy, user, Instant.now(), cancelledBy, cancelledAt, lines);
    }

    public JournalEntry cancel(String user) {
        requireTransition(JournalEntryStatus.CANCELLED);
        return new JournalEntry(id, entryNumber, entryDate, periodId, entryType, sourceType, sourceId,
            sourceNumber, narration, totalDebit, totalCredit, JournalEntryStatus.CANCELLED, reversed,
            reversalOfId, reversedById, createdBy, postedBy, postedAt, user, Instant.now(), lines);
    }

    /**
     * Flags this POSTED entry as reversed by {@code reversalId}. Status stays POSTED.
     */
    public JournalEntry markReversed(UUID reversalId) {
        if (status != JournalEntryStatus.POSTED) {
            throw new IllegalStateException(
                String.format("Cannot reverse journal entry %s in %s status", entryNumber, status));
        }
        if (reversed) {
            throw new IllegalStateException("Journal entry " + entryNumber + " is already reversed");
        }
        return new JournalEntry(id, entryNumber, entryDate, periodId, entryType, sourceType, sourceId,
            sourceNumber, narration, totalDebit, totalCredit, status, true,
            reversalOfId, reversalId, createdBy, postedBy, postedAt, cancelledBy, cancelledAt, lines);
    }

    public boolean isPosted() {
        return status == JournalEntryStatus.POSTED;
    }

    public PostingRequest toPostingRequest() {
        return PostingRequest.builder()
            .entryDate(entryDate)
            .entryType(entryType)
            .narration(narration)
            .source(sourceType != null ? SourceRef.of(sourceType, sourceId, sourceNumber) : null)
            .lines(lines.stream().map(JournalLine::toPostingLine).toList())
            .createdBy(createdBy)
            .entryNumber(entryNumber)
            .build();
    }

    private void requireTransition(JournalEntryStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move journal entry %s from %s to %s", entryNumber, status, target));
        }
    }
}
