package com.flagship.accounting.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * General ledger row: one per posted journal line, carrying the account's balance after the line.
 */
@Value
public class LedgerEntry {
    UUID id;
    long sequenceNumber;
    UUID accountId;
    UUID periodId;
    LocalDate transactionDate;
    UUID journalEntryId;
    String entryNumber;
    UUID journalLineId;
    BigDecimal debit;
    BigDecimal credit;
    BigDecimal runningBalance;
    String narration;
    UUID costCenterId;
    Instant createdAt;
}
