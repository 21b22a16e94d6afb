package com.flagship.accounting.ledger;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA mapping of {@link JournalEntry}.
 *
 * Header amounts, lines and source are fixed at creation; only lifecycle columns change.
 * The idempotency key is a persistence concern and is passed separately from the domain object.
 */
@Entity
@Table(name = "journal_entries")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class JournalEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "entry_number", nullable = false, updatable = false, unique = true)
    private String entryNumber;

    @Column(name = "entry_date", nullable = false, updatable = false)
    private LocalDate entryDate;

    @Column(name = "period_id", nullable = false)
    private UUID periodId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, updatable = false)
    private JournalEntryType entryType;

    @Column(name = "source_type", updatable = false)
    private String sourceType;

    @Column(name = "source_id", updatable = false)
    private UUID sourceId;

    @Column(name = "source_number", updatable = false)
    private String sourceNumber;

    @Column(updatable = false)
    private String narration;

    @Column(name = "total_debit", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal totalDebit;

    @Column(name = "total_credit", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal totalCredit;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JournalEntryStatus status;

    @Column(name = "is_reversed", nullable = false)
    private boolean reversed;

    @Column(name = "reversal_of_id", updatable = false)
    private UUID reversalOfId;

    @Column(name = "reversed_by_id")
    private UUID reversedById;

    @Column(name = "idempotency_key", updatable = false, unique = true)
    private String idempotencyKey;

    @Column(name = "created_by", nullable = false, updatable = false)
    private String createdBy;

    @Column(name = "posted_by")
    private String postedBy;

    @Column(name = "posted_at")
    private Instant postedAt;

    @Column(name = "cancelled_by")
    private String cancelledBy;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @OneToMany(mappedBy = "journalEntry", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("lineNumber ASC")
    private List<JournalEntryLineEntity> lines = new ArrayList<>();

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static JournalEntryEntity fromDomain(JournalEntry entry, String idempotencyKey) {
        JournalEntryEntity entity = new JournalEntryEntity();
        entity.id = entry.getId();
        entity.entryNumber = entry.getEntryNumber();
        entity.entryDate = entry.getEntryDate();
        entity.periodId = entry.getPeriodId();
        entity.entryType = entry.getEntryType();
        entity.sourceType = entry.getSourceType();
        entity.sourceId = entry.getSourceId();
        entity.sourceNumber = entry.getSourceNumber();
        entity.narration = entry.getNarration();
        entity.totalDebit = entry.getTotalDebit();
        entity.totalCredit = entry.getTotalCredit();
        entity.status = entry.getStatus();
        entity.reversed = entry.isReversed();
        entity.reversalOfId = entry.getReversalOfId();
        entity.reversedById = entry.getReversedById();
        entity.idempotencyKey = idempotencyKey;
        entity.createdBy = entry.getCreatedBy();
        entity.postedBy = entry.getPostedBy();
        entity.postedAt = entry.getPostedAt();
        entity.cancelledBy = entry.getCancelledBy();
        entity.cancelledAt = entry.getCancelledAt();
        for (JournalLine line : entry.getLines()) {
            entity.lines.add(JournalEntryLineEntity.fromDomain(line, entity));
        }
        return entity;
    }

    public JournalEntry toDomain() {
        return new JournalEntry(
            id, entryNumber, entryDate, periodId, entryType, sourceType, sourceId, sourceNumber,
            narration, totalDebit, totalCredit, status, reversed, reversalOfId, reversedById,
            createdBy, postedBy, postedAt, cancelledBy, cancelledAt,
            lines.stream().map(JournalEntryLineEntity::toDomain).toList()
        );
    }

    void updateFromDomain(JournalEntry entry) {
        this.periodId = entry.getPeriodId();
        this.status = entry.getStatus();
        this.reversed = entry.isReversed();
        this.reversedById = entry.getReversedById();
        this.postedBy = entry.getPostedBy();
        this.postedAt = entry.getPostedAt();
        this.cancelledBy = entry.getCancelledBy();
        this.cancelledAt = entry.getCancelledAt();
    }
}
