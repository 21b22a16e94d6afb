package com.flagship.accounting.event;

import com.flagship.accounting.depreciation.DepreciationEntry;
import com.flagship.accounting.depreciation.FixedAsset;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published for every depreciation entry written, and again when an unposted entry reaches the ledger.
 */
@Value
public class DepreciationRecordedEvent implements AccountingEvent {
    UUID eventId;
    UUID assetId;
    String assetCode;
    UUID depreciationEntryId;
    String referenceNumber;
    LocalDate periodDate;
    String method;
    BigDecimal amount;
    BigDecimal closingBookValue;
    boolean posted;
    UUID journalEntryId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DepreciationRecorded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return assetId;
    }

    public static DepreciationRecordedEvent from(FixedAsset asset, DepreciationEntry entry) {
        return new DepreciationRecordedEvent(
            UUID.randomUUID(),
            asset.getId(),
            asset.getAssetCode(),
            entry.getId(),
            entry.getReferenceNumber(),
            entry.getPeriodDate(),
            entry.getMethod().name(),
            entry.getAmount(),
            entry.getClosingBookValue(),
            entry.isPosted(),
            entry.getJournalEntryId(),
            Instant.now()
        );
    }
}
