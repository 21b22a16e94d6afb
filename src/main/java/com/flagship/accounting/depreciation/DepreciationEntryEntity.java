package com.flagship.accounting.depreciation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "depreciation_entries",
    uniqueConstraints = @UniqueConstraint(name = "uq_depreciation_asset_period", columnNames = {"asset_id", "period_date"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DepreciationEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "reference_number", nullable = false, updatable = false, unique = true)
    private String referenceNumber;

    @Column(name = "asset_id", nullable = false, updatable = false)
    private UUID assetId;

    @Column(name = "period_date", nullable = false, updatable = false)
    private LocalDate periodDate;

    @Column(name = "financial_year", nullable = false, updatable = false)
    private String financialYear;

    @Column(name = "opening_book_value", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal openingBookValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "depreciation_method", nullable = false, updatable = false)
    private DepreciationMethod method;

    @Column(name = "depreciation_rate", nullable = false, updatable = false, precision = 7, scale = 4)
    private BigDecimal rate;

    @Column(name = "depreciation_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "closing_book_value", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal closingBookValue;

    @Column(name = "accumulated_depreciation", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal accumulatedDepreciation;

    @Column(name = "journal_entry_id")
    private UUID journalEntryId;

    @Column(name = "is_posted", nullable = false)
    private boolean posted;

    @Column(name = "processed_by", nullable = false, updatable = false)
    private String processedBy;

    @Column(name = "processed_at", nullable = false, updatable = false)
    private Instant processedAt;

    static DepreciationEntryEntity fromDomain(DepreciationEntry entry) {
        return new DepreciationEntryEntity(
            entry.getId(),
            entry.getReferenceNumber(),
            entry.getAssetId(),
            entry.getPeriodDate(),
            entry.getFinancialYear(),
            entry.getOpeningBookValue(),
            entry.getMethod(),
            entry.getRate(),
            entry.getAmount(),
            entry.getClosingBookValue(),
            entry.getAccumulatedDepreciation(),
            entry.getJournalEntryId(),
            entry.isPosted(),
            entry.getProcessedBy(),
            entry.getProcessedAt()
        );
    }

    public DepreciationEntry toDomain() {
        return new DepreciationEntry(id, referenceNumber, assetId, periodDate, financialYear, openingBookValue,
            method, rate, amount, closingBookValue, accumulatedDepreciation, journalEntryId, posted,
            processedBy, processedAt);
    }

    void updateFromDomain(DepreciationEntry entry) {
        this.journalEntryId = entry.getJournalEntryId();
        this.posted = entry.isPosted();
    }
}
