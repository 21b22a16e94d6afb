package com.flagship.accounting.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "journal_entry_lines")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class JournalEntryLineEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "journal_entry_id", nullable = false, updatable = false)
    private JournalEntryEntity journalEntry;

    @Column(name = "line_number", nullable = false, updatable = false)
    private int lineNumber;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal debit;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal credit;

    @Column(updatable = false)
    private String description;

    @Column(name = "cost_center_id", updatable = false)
    private UUID costCenterId;

    static JournalEntryLineEntity fromDomain(JournalLine line, JournalEntryEntity journalEntry) {
        JournalEntryLineEntity entity = new JournalEntryLineEntity();
        entity.id = line.getId();
        entity.journalEntry = journalEntry;
        entity.lineNumber = line.getLineNumber();
        entity.accountId = line.getAccountId();
        entity.debit = line.getDebit();
        entity.credit = line.getCredit();
        entity.description = line.getDescription();
        entity.costCenterId = line.getCostCenterId();
        return entity;
    }

    JournalLine toDomain() {
        return new JournalLine(id, lineNumber, accountId, debit, credit, description, costCenterId);
    }
}
