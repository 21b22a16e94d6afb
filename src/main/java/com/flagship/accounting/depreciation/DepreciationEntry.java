package com.flagship.accounting.depreciation;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One month's depreciation of one asset. Unique per (asset, period date).
 */
@Value
public class DepreciationEntry {
    UUID id;
    String referenceNumber;
    UUID assetId;
    LocalDate periodDate;
    String financialYear;
    BigDecimal openingBookValue;
    DepreciationMethod method;
    BigDecimal rate;
    BigDecimal amount;
    BigDecimal closingBookValue;
    BigDecimal accumulatedDepreciation;
    UUID journalEntryId;
    boolean posted;
    String processedBy;
    Instant processedAt;

    static DepreciationEntry compute(String referenceNumber, FixedAsset before, FixedAsset after,
                                     LocalDate periodDate, DepreciationMethod method, BigDecimal rate,
                                     BigDecimal amount, String user) {
        return new DepreciationEntry(UUID.randomUUID(), referenceNumber, before.getId(), periodDate,
            DepreciationCalculator.financialYear(periodDate),
            before.getCurrentBookValue(), method, rate, amount,
            after.getCurrentBookValue(), after.getAccumulatedDepreciation(),
            null, false, user, Instant.now());
    }

    public DepreciationEntry markPosted(UUID postedJournalEntryId) {
        if (posted) {
            throw new IllegalStateException("Depreciation entry " + referenceNumber + " is already posted");
        }
        return new DepreciationEntry(id, referenceNumber, assetId, periodDate, financialYear, openingBookValue,
            method, rate, amount, closingBookValue, accumulatedDepreciation,
            postedJournalEntryId, true, processedBy, processedAt);
    }
}
